package com.excsn.pathstore.core;

import com.google.common.base.Preconditions;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Shell style wildcard matching over whole paths.
 * <p>
 * Supports {@code *}, {@code ?} and bracket expressions ({@code [abc]}, {@code [a-z]}, {@code [!x]},
 * {@code [^x]}, {@code [[:digit:]]}). A backslash is an ordinary character, and wildcards also match
 * the path separator.
 */
final class GlobPattern {

  private static final Map<String, String> CHAR_CLASSES = Map.ofEntries(
    Map.entry("alpha", "\\p{Alpha}"),
    Map.entry("digit", "\\p{Digit}"),
    Map.entry("alnum", "\\p{Alnum}"),
    Map.entry("upper", "\\p{Upper}"),
    Map.entry("lower", "\\p{Lower}"),
    Map.entry("space", "\\p{Space}"),
    Map.entry("blank", "\\p{Blank}"),
    Map.entry("punct", "\\p{Punct}"),
    Map.entry("xdigit", "\\p{XDigit}"),
    Map.entry("cntrl", "\\p{Cntrl}"),
    Map.entry("graph", "\\p{Graph}"),
    Map.entry("print", "\\p{Print}")
  );

  private static final String REGEX_SPECIALS = "\\^$.|?*+()[]{}";

  private final String _glob;
  private final Pattern _pattern;

  private GlobPattern(String glob, Pattern pattern) {
    _glob = glob;
    _pattern = pattern;
  }

  static GlobPattern compile(String glob) {

    Preconditions.checkNotNull(glob, "glob pattern is null");

    return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
  }

  boolean matches(String path) {

    return _pattern.matcher(path).matches();
  }

  @Override
  public String toString() {
    return _glob;
  }

  static String toRegex(String glob) {

    var regex = new StringBuilder();
    var idx = 0;

    while (idx < glob.length()) {

      var ch = glob.charAt(idx);

      if (ch == '*') {
        regex.append(".*");
        idx++;
      } else if (ch == '?') {
        regex.append('.');
        idx++;
      } else if (ch == '[') {

        var end = _bracketEnd(glob, idx);

        if (end < 0) {
          // Unterminated bracket is a literal '['
          regex.append("\\[");
          idx++;
        } else {
          regex.append(_bracketToRegex(glob.substring(idx + 1, end)));
          idx = end + 1;
        }
      } else {
        _appendLiteral(regex, ch);
        idx++;
      }
    }

    return regex.toString();
  }

  /**
   * @return index of the ']' closing the bracket expression opened at start, or -1
   */
  private static int _bracketEnd(String glob, int start) {

    var idx = start + 1;
    var len = glob.length();

    if (idx < len && (glob.charAt(idx) == '!' || glob.charAt(idx) == '^')) {
      idx++;
    }

    // A leading ']' is part of the set
    if (idx < len && glob.charAt(idx) == ']') {
      idx++;
    }

    while (idx < len && glob.charAt(idx) != ']') {

      if (glob.startsWith("[:", idx)) {

        var classEnd = glob.indexOf(":]", idx + 2);
        if (classEnd >= 0) {
          idx = classEnd + 2;
          continue;
        }
      }

      idx++;
    }

    return idx < len ? idx : -1;
  }

  private static String _bracketToRegex(String body) {

    var regex = new StringBuilder("[");
    var idx = 0;

    if (body.charAt(0) == '!' || body.charAt(0) == '^') {
      regex.append('^');
      idx++;
    }

    var members = 0;

    while (idx < body.length()) {

      if (body.startsWith("[:", idx)) {

        var classEnd = body.indexOf(":]", idx + 2);
        var charClass = classEnd < 0 ? null : CHAR_CLASSES.get(body.substring(idx + 2, classEnd));

        if (charClass != null) {
          regex.append(charClass);
          members++;
          idx = classEnd + 2;
          continue;
        }
      }

      var ch = body.charAt(idx);

      if (idx + 2 < body.length() && body.charAt(idx + 1) == '-') {

        var rangeEnd = body.charAt(idx + 2);

        // A reversed range matches nothing
        if (ch <= rangeEnd) {
          _appendClassMember(regex, ch);
          regex.append('-');
          _appendClassMember(regex, rangeEnd);
          members++;
        }

        idx += 3;
        continue;
      }

      _appendClassMember(regex, ch);
      members++;
      idx++;
    }

    if (members == 0) {
      // Nothing left to match against, e.g. "[z-a]"
      return regex.length() > 1 ? "(?s:.)" : "(?!)";
    }

    return regex.append(']').toString();
  }

  private static void _appendClassMember(StringBuilder regex, char ch) {

    if (ch == '\\' || ch == '[' || ch == ']' || ch == '^' || ch == '&' || ch == '-') {
      regex.append('\\');
    }

    regex.append(ch);
  }

  private static void _appendLiteral(StringBuilder regex, char ch) {

    if (REGEX_SPECIALS.indexOf(ch) >= 0) {
      regex.append('\\');
    }

    regex.append(ch);
  }
}
