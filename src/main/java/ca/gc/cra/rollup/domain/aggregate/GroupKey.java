package ca.gc.cra.rollup.domain.aggregate;

import java.util.List;
import java.util.Objects;

/**
 * Identity of a group within one compression pass.
 *
 * <p>Compared structurally: two records share a key only when they fall in the same window and
 * carry the same group-by and unique fields with the same values. A record missing a field
 * therefore never collides with one that has it.</p>
 *
 * @param windowStart start of the time window, in seconds
 * @param groupBy present group-by fields in configuration order
 * @param unique present unique fields in configuration order
 * @since 0.1.0
 */
public record GroupKey(long windowStart, List<Tag> groupBy, List<Tag> unique) {
  public GroupKey {
    groupBy = List.copyOf(Objects.requireNonNull(groupBy, "groupBy"));
    unique = List.copyOf(Objects.requireNonNull(unique, "unique"));
  }

  /**
   * A named field value carried by a group and copied onto its output record.
   *
   * @param field configured field path
   * @param value textual value
   */
  public record Tag(String field, String value) {
    public Tag {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(value, "value");
    }
  }
}
