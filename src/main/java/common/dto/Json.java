package common.dto;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/** Shared mapper setup for saves, snapshots and the command wire format. */
public final class Json {
    private Json() {}

    public static ObjectMapper mapper() {
        var M = new ObjectMapper();
        M.findAndRegisterModules();
        M.registerModule(new ParameterNamesModule());
        // saves written by newer builds may carry fields this one does not know
        M.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        M.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return M;
    }
}
