package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Message exchanged between the supervisor and a worker.
 * Serialized as one JSON object per line, discriminated by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExecuteMessage.class, name = "execute"),
        @JsonSubTypes.Type(value = TerminateMessage.class, name = "terminate"),
        @JsonSubTypes.Type(value = ReadyMessage.class, name = "ready"),
        @JsonSubTypes.Type(value = ResultMessage.class, name = "result"),
        @JsonSubTypes.Type(value = LogMessage.class, name = "log"),
        @JsonSubTypes.Type(value = MetricsMessage.class, name = "metrics"),
        @JsonSubTypes.Type(value = ErrorMessage.class, name = "error")
})
public interface WorkerMessage {
}
