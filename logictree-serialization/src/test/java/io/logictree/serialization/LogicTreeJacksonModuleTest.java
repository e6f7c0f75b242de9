package io.logictree.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.logictree.core.storage.BranchRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogicTreeJacksonModuleTest {

    private final ObjectMapper mapper = LogicTreeCodec.createMapper();

    @Test
    void shouldWriteRecordAsCompactArray() throws Exception {
        String json = mapper.writeValueAsString(new BranchRecord("bs1", "b1", "A", 0.3));

        assertThat(json).isEqualTo("[\"bs1\",\"b1\",\"A\",0.3]");
    }

    @Test
    void shouldReadRecordList() throws Exception {
        List<BranchRecord> records =
                mapper.readValue(
                        "[[\"bs1\",\"b1\",\"A\",0.3],[\"bs1\",\"b2\",\"B\",0.7]]",
                        new TypeReference<List<BranchRecord>>() {});

        assertThat(records)
                .containsExactly(
                        new BranchRecord("bs1", "b1", "A", 0.3),
                        new BranchRecord("bs1", "b2", "B", 0.7));
    }

    @Test
    void shouldReadIntegerWeight() throws Exception {
        BranchRecord record = mapper.readValue("[\"bs1\",\"b1\",\"A\",1]", BranchRecord.class);

        assertThat(record.weight()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectShortRow() {
        assertThatThrownBy(() -> mapper.readValue("[\"bs1\",\"b1\",\"A\"]", BranchRecord.class))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("Expected [bsid, brid, uncertainty, weight]");
    }

    @Test
    void shouldRejectTextWeight() {
        String row = "[\"bs1\",\"b1\",\"A\",\"0.3\"]";

        assertThatThrownBy(() -> mapper.readValue(row, BranchRecord.class))
                .isInstanceOf(JsonMappingException.class)
                .hasMessageContaining("must be numeric");
    }
}
