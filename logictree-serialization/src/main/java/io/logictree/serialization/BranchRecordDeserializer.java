package io.logictree.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.logictree.core.storage.BranchRecord;
import java.io.IOException;
import java.io.Serial;

/// Deserializes the four-element array written by {@link BranchRecordSerializer}.
///
/// The row is read from the `JsonNode` tree and checked field by field; a row of the wrong
/// width or with a non-numeric weight is rejected.
class BranchRecordDeserializer extends StdDeserializer<BranchRecord> {

    @Serial private static final long serialVersionUID = -1964235501877420961L;

    BranchRecordDeserializer() {
        super(BranchRecord.class);
    }

    @Override
    public BranchRecord deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode row = p.getCodec().readTree(p);

        if (row == null || !row.isArray() || row.size() != 4) {
            throw JsonMappingException.from(
                    p, "Expected [bsid, brid, uncertainty, weight], got " + row);
        }
        if (!row.get(3).isNumber()) {
            throw JsonMappingException.from(
                    p, "Branch weight must be numeric, got " + row.get(3));
        }
        return new BranchRecord(
                row.get(0).asText(),
                row.get(1).asText(),
                row.get(2).asText(),
                row.get(3).doubleValue());
    }
}
