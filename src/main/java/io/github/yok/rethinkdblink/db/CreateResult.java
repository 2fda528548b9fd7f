package io.github.yok.rethinkdblink.db;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * What the server reported for a create call.
 *
 * <p>
 * RethinkDB answers {@code dbCreate}/{@code tableCreate} with a document such as
 * {@code {dbs_created: 1, config_changes: [...]}}. Only the created count is kept; a count of zero
 * means the call did not create anything.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CreateResult {

    private static final CreateResult NOTHING = new CreateResult(0);

    private final long createdCount;

    private CreateResult(long createdCount) {
        this.createdCount = createdCount;
    }

    /**
     * Returns a result for the given created count.
     *
     * @param createdCount number of created entities reported by the server
     * @return result
     */
    public static CreateResult of(long createdCount) {
        return createdCount <= 0 ? NOTHING : new CreateResult(createdCount);
    }

    /**
     * Returns a result that reports nothing created.
     *
     * @return empty result
     */
    public static CreateResult nothing() {
        return NOTHING;
    }

    /**
     * Returns whether at least one entity was created.
     *
     * @return {@code true} if the create call had an effect
     */
    public boolean isCreated() {
        return createdCount > 0;
    }
}
