package io.logictree.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.logictree.core.storage.BranchRecord;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `BranchRecord` as a fixed-width four-element array:
/// `[bsid, brid, uncertainty, weight]`.
///
/// @see BranchRecordDeserializer for the inverse operation
class BranchRecordSerializer extends StdSerializer<BranchRecord> {

    @Serial private static final long serialVersionUID = 2207156734190823305L;

    BranchRecordSerializer() {
        super(BranchRecord.class);
    }

    @Override
    public void serialize(BranchRecord record, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        gen.writeString(record.bsid());
        gen.writeString(record.brid());
        gen.writeString(record.uncertainty());
        gen.writeNumber(record.weight());
        gen.writeEndArray();
    }
}
