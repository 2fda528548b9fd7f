package io.github.yok.rethinkdblink.db;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Reference to a database object on the server, used as the scope of table operations.
 *
 * <p>
 * Equality is by name only: a reference captured while creating the database and one obtained by
 * name later are interchangeable.
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class DatabaseReference {

    private final String name;

    /**
     * Creates a reference.
     *
     * @param name database name
     * @throws IllegalArgumentException if the name is blank
     */
    public DatabaseReference(String name) {
        Preconditions.checkArgument(StringUtils.isNotBlank(name), "name must not be blank");
        this.name = name;
    }

    @Override
    public String toString() {
        return "db(" + name + ")";
    }
}
