/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pyunparse.util;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Locale;

/** Utilities for writing string and bytes literals. */
public final class Escapes {
  private Escapes() {}

  /**
   * Converts a character to how it appears inside a string literal delimited
   * by {@code quote}.
   *
   * <p>For example, '{@code a}' becomes "{@code a}", the tab character becomes
   * "{@code \t}", character 1 becomes "{@code \x01}", and the line separator
   * U+2028 becomes "{@code \\u2028}". Surrogates are handled by
   * {@link #stringToString(String, char, StringBuilder)}; an unpaired
   * surrogate passed here becomes a {@code \\u} escape.
   */
  public static String charToString(char c, char quote) {
    switch (c) {
      case '\t':
        return "\\t";
      case '\n':
        return "\\n";
      case '\r':
        return "\\r";
      case '\\':
        // Backslash requires escape
        return "\\\\";
      case 0x2028:
      case 0x2029:
        // Line and paragraph separators
        return hex("\\u%04x", c);
      default:
        if (c == quote) {
          return "\\" + c;
        }
        if (c < 32 || c >= 127 && c < 160) {
          // C0 and C1 control characters, and DEL
          return hex("\\x%02x", c);
        }
        if (Character.isSurrogate(c)) {
          return hex("\\u%04x", c);
        }
        return String.valueOf(c);
    }
  }

  /**
   * Converts an internal string to the body of a string literal, escaping
   * characters as necessary, appending to a builder.
   */
  public static StringBuilder stringToString(String s, char quote,
      StringBuilder b) {
    checkQuote(quote);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (Character.isHighSurrogate(c)
          && i + 1 < s.length()
          && Character.isLowSurrogate(s.charAt(i + 1))) {
        // A well-formed pair is a supplementary character; copy it as is.
        b.append(c).append(s.charAt(++i));
      } else {
        b.append(charToString(c, quote));
      }
    }
    return b;
  }

  /** Converts an internal string to a quoted string literal, e.g.
   * {@code a"b} to {@code "a\"b"}. */
  public static String quote(String s, char quote) {
    checkQuote(quote);
    final StringBuilder b = new StringBuilder();
    b.append(quote);
    if (requiresEscape(s, quote)) {
      stringToString(s, quote, b);
    } else {
      b.append(s);
    }
    return b.append(quote).toString();
  }

  /** Converts a byte array to a quoted bytes literal, e.g. {@code b"a\x00"}.
   * Printable ASCII characters other than backslash and the quote are
   * written as is; every other byte is escaped. */
  public static String quoteBytes(byte[] bytes, char quote) {
    checkQuote(quote);
    final StringBuilder b = new StringBuilder();
    b.append('b').append(quote);
    for (byte x : bytes) {
      final int c = x & 0xFF;
      if (c == '\t' || c == '\n' || c == '\r' || c == '\\' || c == quote) {
        b.append(charToString((char) c, quote));
      } else if (c >= 32 && c < 127) {
        b.append((char) c);
      } else {
        b.append(hex("\\x%02x", c));
      }
    }
    return b.append(quote).toString();
  }

  private static boolean requiresEscape(String s, char quote) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < 32 || c == quote || c == '\\' || c >= 127) {
        // Control characters, quote, backslash, non-ASCII may require escape
        return true;
      }
    }
    return false;
  }

  private static void checkQuote(char quote) {
    checkArgument(quote == '"' || quote == '\'', "invalid quote %s", quote);
  }

  private static String hex(String format, int c) {
    return String.format(Locale.ROOT, format, c);
  }
}

// End Escapes.java
