package com.flamingo.ai.summarizer.service.prompt;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code {{key}}} placeholder substitution. */
public final class PromptTemplates {

  public static final String CONTENT = "content";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}");

  private PromptTemplates() {}

  /**
   * Replaces each {@code {{key}}} in {@code template} with its value from {@code variables}. Keys
   * are trimmed before lookup; placeholders without a value are left as they are.
   */
  public static String substitute(String template, Map<String, String> variables) {
    if (template == null || template.isEmpty()) {
      return "";
    }
    if (variables == null || variables.isEmpty()) {
      return template;
    }
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder result = new StringBuilder(template.length());
    while (matcher.find()) {
      String value = variables.get(matcher.group(1).trim());
      String replacement = value != null ? value : matcher.group();
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /** Whether {@code template} contains a {@code {{key}}} placeholder. */
  public static boolean hasPlaceholder(String template, String key) {
    if (template == null) {
      return false;
    }
    Matcher matcher = PLACEHOLDER.matcher(template);
    while (matcher.find()) {
      if (matcher.group(1).trim().equals(key)) {
        return true;
      }
    }
    return false;
  }
}
