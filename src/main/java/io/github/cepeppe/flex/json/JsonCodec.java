package io.github.cepeppe.flex.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.exception.FlexException;
import io.github.cepeppe.flex.logging.FlexLogger;

import java.io.IOException;

/**
 * JsonCodec
 *
 * Rendering JSON del grafo tipizzato (usato dalla CLI e per ispezione/debug).
 *
 *  - Date e ore: ISO-8601 ({@code 2017-06-05}, {@code 16:20:00}, {@code 2017-06-05T16:20:00}).
 *  - Decimali: notazione piana, scala del sorgente conservata ({@code 368.80}, mai {@code 3.688E+2}).
 *  - Codici: testo del documento ({@code "BUY (Ca.)"}), noti o non riconosciuti.
 *  - Campi assenti: scritti come {@code null}, così gli insiemi di campi restano confrontabili.
 */
public final class JsonCodec {

    private static final FlexLogger log = FlexLogger.getLogger(JsonCodec.class);

    private static final ObjectMapper MAPPER = buildMapper();
    private static final ObjectWriter WRITER = MAPPER.writer();
    private static final ObjectWriter PRETTY_WRITER = MAPPER.writerWithDefaultPrettyPrinter();

    private JsonCodec() {}

    /* =========================================================================================
       COSTRUZIONE MAPPER
       ========================================================================================= */

    private static ObjectMapper buildMapper() {
        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        om.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

        SimpleModule mod = new SimpleModule("flex-code-serializer");
        mod.addSerializer(new FlexCodeSerializer());
        om.registerModule(mod);
        return om;
    }

    /** {@link FlexCode} come stringa: il testo del documento. */
    @SuppressWarnings({"rawtypes", "unchecked"})
    static final class FlexCodeSerializer extends StdSerializer<FlexCode> {

        FlexCodeSerializer() {
            super(FlexCode.class);
        }

        @Override
        public void serialize(FlexCode value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.raw());
        }
    }

    /* =========================================================================================
       API PUBBLICA
       ========================================================================================= */

    /** Serializza in JSON compatto. */
    public static String toJson(Object value) {
        return write(WRITER, value);
    }

    /** Serializza in JSON indentato (output della CLI). */
    public static String toPrettyJson(Object value) {
        return write(PRETTY_WRITER, value);
    }

    /** Mapper condiviso (thread-safe, da non riconfigurare). */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    private static String write(ObjectWriter writer, Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("JsonCodec serialization failed: {}", e.getMessage(), e);
            throw FlexException.wrap(e, FlexException.Code.INTERNAL, "JSON serialization error",
                    "type", value == null ? "null" : value.getClass().getSimpleName());
        }
    }
}
