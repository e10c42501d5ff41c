package com.gentoro.onellm.config;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a configured credential is a documented placeholder rather than a real value.
 * Placeholder credentials are treated exactly like missing ones.
 */
public final class PlaceholderPolicy {
  private static final Pattern TEMPLATE_VALUE =
      Pattern.compile("^your[_-].*[_-]here$", Pattern.CASE_INSENSITIVE);
  private static final Set<String> WELL_KNOWN =
      Set.of("changeme", "change-me", "todo", "none", "null", "sk-...", "xxx");

  private final Set<String> extra;

  public PlaceholderPolicy(Collection<String> extraPlaceholders) {
    this.extra =
        extraPlaceholders == null
            ? Set.of()
            : extraPlaceholders.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
  }

  public static PlaceholderPolicy defaults() {
    return new PlaceholderPolicy(Set.of());
  }

  /** True when {@code value} is absent, blank, an unresolved variable or a placeholder. */
  public boolean isPlaceholder(String value) {
    if (value == null || value.isBlank()) {
      return true;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith("${") && normalized.endsWith("}")) {
      return true;
    }
    if (normalized.startsWith("<") && normalized.endsWith(">")) {
      return true;
    }
    return TEMPLATE_VALUE.matcher(normalized).matches()
        || WELL_KNOWN.contains(normalized)
        || extra.contains(normalized);
  }
}
