package com.codeheadsystems.suitekey.server.scope;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One OAuth scope string, e.g. {@code https://www.googleapis.com/auth/spreadsheets}.
 * <p>
 * The value is opaque to the core; two scopes are equal exactly when their strings are equal.
 *
 * @param value the scope string as understood by the provider
 */
public record AuthorizationScope(String value) implements Comparable<AuthorizationScope> {

  /**
   * Instantiates a new Authorization scope.
   *
   * @param value the value
   */
  public AuthorizationScope {
    Objects.requireNonNull(value, "value");
    if (value.isBlank() || value.chars().anyMatch(Character::isWhitespace)) {
      throw new IllegalArgumentException("Scope must be a single non-blank token: '" + value + "'");
    }
  }

  /**
   * Builds an immutable scope set from raw strings.
   *
   * @param values the values
   * @return the set
   */
  public static Set<AuthorizationScope> setOf(String... values) {
    return Arrays.stream(values).map(AuthorizationScope::new).collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Parses the space-delimited {@code scope} field of a token response.
   *
   * @param spaceDelimited the provider's scope string, may be null
   * @return the set, empty if the input is null or blank
   */
  public static Set<AuthorizationScope> parse(String spaceDelimited) {
    if (spaceDelimited == null || spaceDelimited.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(spaceDelimited.trim().split("\\s+"))
        .map(AuthorizationScope::new)
        .collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Joins scopes with single spaces in sorted order, the form used in a consent URL.
   *
   * @param scopes the scopes
   * @return the string
   */
  public static String join(Collection<AuthorizationScope> scopes) {
    return scopes.stream().sorted().map(AuthorizationScope::value).collect(Collectors.joining(" "));
  }

  /**
   * Sorted raw values, for wire models.
   *
   * @param scopes the scopes
   * @return the list
   */
  public static List<String> sortedValues(Collection<AuthorizationScope> scopes) {
    return scopes.stream().sorted().map(AuthorizationScope::value).toList();
  }

  @Override
  public int compareTo(AuthorizationScope other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
