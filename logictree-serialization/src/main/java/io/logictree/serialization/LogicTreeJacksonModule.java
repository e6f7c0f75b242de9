package io.logictree.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.logictree.core.storage.BranchRecord;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the logic tree serialization configuration.
///
/// - `BranchRecord`: `BranchRecordSerializer` / `BranchRecordDeserializer`, written as a
///   compact `[bsid, brid, uncertainty, weight]` row instead of an object per branch
///
/// @see LogicTreeCodec for the convenience factory API
public class LogicTreeJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5315260925563089410L;

    public LogicTreeJacksonModule() {
        super("LogicTreeJacksonModule");

        addSerializer(BranchRecord.class, new BranchRecordSerializer());
        addDeserializer(BranchRecord.class, new BranchRecordDeserializer());
    }
}
