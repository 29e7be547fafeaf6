package eu.virtualparadox.docsearch.query.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Payload handed to the conversational agent for one knowledge question.
 * Either {@code found} with ranked passages, or not found with a clarifying message.
 */
@Builder
@Getter
public class LookupResponse {

    private final boolean found;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String message;

    @Singular
    private final List<LookupPassage> passages;

    public static LookupResponse notFound(final String message) {
        return LookupResponse.builder()
                .found(false)
                .message(message)
                .build();
    }
}
