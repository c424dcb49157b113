package tech.warden.iam.mirror;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Builder;
import tech.warden.iam.common.RequestContext;
import tech.warden.iam.shared.TsidGenerator;

import java.time.Instant;
import java.util.Set;

/**
 * Notification that the effective membership of a group changed.
 *
 * <p>{@code groupKey} is the mutated group itself or one of its ancestors
 * ({@code direct} tells which). {@code changedMemberKeys} are the subjects added to
 * or removed from the mutated group; for a deleted group, every member it had.
 */
@Builder
public record GroupMembershipChange(
    String notificationId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String groupKey,
    String groupEmail,
    boolean direct,
    Kind kind,
    Set<String> changedMemberKeys
) {

    public enum Kind {
        /** Direct members were added or removed. */
        MEMBERS_CHANGED,
        /** Roles, actions, descendant permissions or the public flag of a policy changed. */
        GRANTS_CHANGED,
        /** The group is gone; mirrors should drop it. */
        GROUP_DELETED
    }

    @JsonIgnore
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @JsonIgnore
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize membership change", e);
        }
    }

    /**
     * Create a pre-configured builder with metadata from the request context.
     */
    public static GroupMembershipChangeBuilder fromContext(RequestContext ctx) {
        return GroupMembershipChange.builder()
            .notificationId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
