package scenariopool.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON codec for {@link WorkerMessage}s. One message per line: the default
 * (non-indenting) writer escapes embedded newlines, so a line-based frame
 * decoder can split the stream.
 */
public final class MessageCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private static final ObjectWriter WRITER = MAPPER.writerFor(WorkerMessage.class);
    private static final ObjectReader READER = MAPPER.readerFor(WorkerMessage.class);

    private MessageCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(WorkerMessage message) {
        try {
            return WRITER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the line is not a known message
     */
    public static WorkerMessage decode(String line) {
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("empty message");
        }
        try {
            return READER.readValue(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed worker message: " + e.getOriginalMessage(), e);
        }
    }
}
