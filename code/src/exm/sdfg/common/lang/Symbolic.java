/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sdfg.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for the symbolic expressions that appear in subsets, shapes,
 * conditions, assignments and code.
 *
 * Expressions are kept as strings in Python-like syntax.  Nothing here
 * evaluates them: we only need to find names, rename them, and compare
 * simple affine bounds.
 */
public class Symbolic {

  public static final String TRUE = "True";
  public static final String FALSE = "False";

  private static final Set<String> KEYWORDS = new HashSet<String>(
      Arrays.asList("and", "or", "not", "in", "is", "if", "else", "elif",
          "True", "False", "None", "true", "false", "lambda", "for", "while",
          "return", "def", "pass", "break", "continue", "import", "from",
          "as", "with", "yield", "global", "nonlocal", "del", "assert",
          "try", "except", "finally", "raise", "class"));

  public static enum TokenKind {
    IDENT,
    NUMBER,
    STRING,
    OTHER,
  }

  public static class Token {
    public final TokenKind kind;
    public final String text;

    public Token(TokenKind kind, String text) {
      this.kind = kind;
      this.text = text;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /**
   * Split an expression or code fragment into tokens.  Whitespace is kept
   * as OTHER tokens so that joining the tokens gives back the input.
   */
  public static List<Token> tokenize(String code) {
    List<Token> toks = new ArrayList<Token>();
    int i = 0;
    int n = code.length();
    while (i < n) {
      char c = code.charAt(i);
      int start = i;
      if (Character.isLetter(c) || c == '_') {
        while (i < n && (Character.isLetterOrDigit(code.charAt(i)) ||
                         code.charAt(i) == '_')) {
          i++;
        }
        toks.add(new Token(TokenKind.IDENT, code.substring(start, i)));
      } else if (Character.isDigit(c)) {
        while (i < n && (Character.isLetterOrDigit(code.charAt(i)) ||
                         code.charAt(i) == '_' || code.charAt(i) == '.')) {
          i++;
        }
        toks.add(new Token(TokenKind.NUMBER, code.substring(start, i)));
      } else if (c == '"' || c == '\'') {
        i++;
        while (i < n && code.charAt(i) != c) {
          if (code.charAt(i) == '\\') {
            i++;
          }
          i++;
        }
        i = Math.min(i + 1, n);
        toks.add(new Token(TokenKind.STRING, code.substring(start, i)));
      } else {
        i++;
        toks.add(new Token(TokenKind.OTHER, code.substring(start, i)));
      }
    }
    return toks;
  }

  /**
   * Index of next non-whitespace token at or after i, or -1
   */
  private static int nextSignificant(List<Token> toks, int i) {
    for (int j = i; j < toks.size(); j++) {
      Token t = toks.get(j);
      if (t.kind != TokenKind.OTHER || t.text.trim().length() > 0) {
        return j;
      }
    }
    return -1;
  }

  private static int prevSignificant(List<Token> toks, int i) {
    for (int j = i; j >= 0; j--) {
      Token t = toks.get(j);
      if (t.kind != TokenKind.OTHER || t.text.trim().length() > 0) {
        return j;
      }
    }
    return -1;
  }

  private static boolean isAttribute(List<Token> toks, int i) {
    int prev = prevSignificant(toks, i - 1);
    return prev >= 0 && toks.get(prev).text.equals(".");
  }

  private static boolean isCall(List<Token> toks, int i) {
    int next = nextSignificant(toks, i + 1);
    return next >= 0 && toks.get(next).text.equals("(");
  }

  /**
   * Names referenced by an expression, excluding keywords, called
   * functions and attribute names.
   */
  public static Set<String> freeSymbols(String expr) {
    Set<String> result = new LinkedHashSet<String>();
    if (expr == null) {
      return result;
    }
    List<Token> toks = tokenize(expr);
    for (int i = 0; i < toks.size(); i++) {
      Token t = toks.get(i);
      if (t.kind == TokenKind.IDENT && !KEYWORDS.contains(t.text) &&
          !isAttribute(toks, i) && !isCall(toks, i)) {
        result.add(t.text);
      }
    }
    return result;
  }

  /**
   * Names of functions called in the code
   */
  public static Set<String> calledNames(String code) {
    Set<String> result = new LinkedHashSet<String>();
    if (code == null) {
      return result;
    }
    List<Token> toks = tokenize(code);
    for (int i = 0; i < toks.size(); i++) {
      Token t = toks.get(i);
      if (t.kind == TokenKind.IDENT && !KEYWORDS.contains(t.text) &&
          !isAttribute(toks, i) && isCall(toks, i)) {
        result.add(t.text);
      }
    }
    return result;
  }

  /**
   * Free names of a block of Python-like statements: every name read,
   * minus names in ignore and names the code assigns itself.
   */
  public static Set<String> codeFreeSymbols(String code,
                                            Set<String> ignore) {
    Set<String> assigned = new HashSet<String>();
    for (String stmt: splitStatements(code)) {
      String target = assignmentTarget(stmt);
      if (target != null) {
        assigned.add(target);
      }
    }
    Set<String> result = freeSymbols(code);
    result.removeAll(assigned);
    result.removeAll(ignore);
    return result;
  }

  /**
   * Find the tokens of opaque (e.g. C++) code that name one of the
   * potential symbols.
   */
  public static Set<String> symbolsInCode(String code,
          Set<String> potentialSymbols, Set<String> symbolsToIgnore) {
    Set<String> result = new LinkedHashSet<String>();
    if (code == null) {
      return result;
    }
    for (Token t: tokenize(code)) {
      if (t.kind == TokenKind.IDENT && potentialSymbols.contains(t.text) &&
          !symbolsToIgnore.contains(t.text)) {
        result.add(t.text);
      }
    }
    return result;
  }

  /**
   * Rename whole-word occurrences of names.  Compound replacements are
   * parenthesized.
   */
  public static String replaceSymbols(String expr, Map<String, String> repl) {
    if (expr == null || repl.isEmpty()) {
      return expr;
    }
    StringBuilder sb = new StringBuilder();
    List<Token> toks = tokenize(expr);
    for (int i = 0; i < toks.size(); i++) {
      Token t = toks.get(i);
      if (t.kind == TokenKind.IDENT && repl.containsKey(t.text) &&
          !isAttribute(toks, i)) {
        String r = repl.get(t.text);
        if (isIdentifier(r) || isInteger(r)) {
          sb.append(r);
        } else {
          sb.append("(").append(r).append(")");
        }
      } else {
        sb.append(t.text);
      }
    }
    return sb.toString();
  }

  public static String replaceSymbol(String expr, String name,
                                     String newName) {
    Map<String, String> repl = new HashMap<String, String>();
    repl.put(name, newName);
    return replaceSymbols(expr, repl);
  }

  public static String negate(String cond) {
    if (isTrue(cond)) {
      return FALSE;
    } else if (cond.trim().equals(FALSE)) {
      return TRUE;
    }
    return "not (" + cond.trim() + ")";
  }

  public static boolean isTrue(String cond) {
    if (cond == null) {
      return true;
    }
    String c = cond.trim();
    return c.isEmpty() || c.equals(TRUE) || c.equals("true") || c.equals("1");
  }

  public static boolean isIdentifier(String s) {
    if (s == null || s.isEmpty()) {
      return false;
    }
    List<Token> toks = tokenize(s);
    return toks.size() == 1 && toks.get(0).kind == TokenKind.IDENT &&
           !KEYWORDS.contains(s);
  }

  public static boolean isInteger(String s) {
    if (s == null) {
      return false;
    }
    try {
      Long.parseLong(s.trim());
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  /**
   * Split code on newlines and semicolons outside of strings and brackets
   */
  public static List<String> splitStatements(String code) {
    List<String> stmts = new ArrayList<String>();
    if (code == null) {
      return stmts;
    }
    StringBuilder cur = new StringBuilder();
    int depth = 0;
    for (Token t: tokenize(code)) {
      if (t.kind == TokenKind.OTHER) {
        if (t.text.equals("(") || t.text.equals("[") || t.text.equals("{")) {
          depth++;
        } else if (t.text.equals(")") || t.text.equals("]") ||
                   t.text.equals("}")) {
          depth--;
        } else if (depth == 0 && (t.text.equals(";") || t.text.equals("\n"))) {
          addStatement(stmts, cur);
          continue;
        }
      }
      cur.append(t.text);
    }
    addStatement(stmts, cur);
    return stmts;
  }

  private static void addStatement(List<String> stmts, StringBuilder cur) {
    String s = cur.toString().trim();
    if (s.length() > 0) {
      stmts.add(s);
    }
    cur.setLength(0);
  }

  /**
   * @return the target of a simple assignment "name = expr", or null if
   *        the statement is anything else
   */
  public static String assignmentTarget(String stmt) {
    List<Token> toks = tokenize(stmt);
    int first = nextSignificant(toks, 0);
    if (first < 0 || toks.get(first).kind != TokenKind.IDENT ||
        KEYWORDS.contains(toks.get(first).text)) {
      return null;
    }
    int eq = nextSignificant(toks, first + 1);
    if (eq < 0 || !toks.get(eq).text.equals("=")) {
      return null;
    }
    // Reject "==" comparisons
    if (eq + 1 < toks.size() && toks.get(eq + 1).text.equals("=")) {
      return null;
    }
    if (nextSignificant(toks, eq + 1) < 0) {
      return null;
    }
    return toks.get(first).text;
  }

  /**
   * Parse a block of simple assignments.
   * @param code e.g. "i = 0; j = N - 1"
   * @return target to value expression in statement order, or null if any
   *          statement is not a simple assignment
   */
  public static LinkedHashMap<String, String> parseAssignments(String code) {
    LinkedHashMap<String, String> result = new LinkedHashMap<String, String>();
    for (String stmt: splitStatements(code)) {
      String target = assignmentTarget(stmt);
      if (target == null) {
        return null;
      }
      String value = stmt.substring(stmt.indexOf('=') + 1).trim();
      result.put(target, value);
    }
    return result;
  }

  /**
   * Check a &lt;= b where both are affine in the same symbols and differ
   * by a constant.  Anything more complicated is reported as unknown,
   * i.e. false.
   */
  public static boolean provablyLessEqual(String a, String b) {
    if (a.trim().equals(b.trim())) {
      return true;
    }
    Map<String, Long> fa = Affine.parse(a);
    Map<String, Long> fb = Affine.parse(b);
    if (fa == null || fb == null) {
      return false;
    }
    Set<String> keys = new HashSet<String>(fa.keySet());
    keys.addAll(fb.keySet());
    for (String k: keys) {
      if (k.equals(Affine.CONST)) {
        continue;
      }
      if (!Affine.coeff(fa, k).equals(Affine.coeff(fb, k))) {
        return false;
      }
    }
    return Affine.coeff(fa, Affine.CONST) <= Affine.coeff(fb, Affine.CONST);
  }

  /**
   * Recursive descent parser for integer affine expressions, giving
   * symbol to coefficient with the constant under CONST.
   */
  private static class Affine {
    static final String CONST = "";

    private final List<Token> toks = new ArrayList<Token>();
    private int pos = 0;

    private Affine(String expr) {
      for (Token t: tokenize(expr)) {
        if (t.kind != TokenKind.OTHER || t.text.trim().length() > 0) {
          toks.add(t);
        }
      }
    }

    static Long coeff(Map<String, Long> f, String k) {
      Long v = f.get(k);
      return v == null ? Long.valueOf(0) : v;
    }

    static Map<String, Long> parse(String expr) {
      Affine p = new Affine(expr);
      Map<String, Long> r = p.expr();
      if (r == null || p.pos != p.toks.size()) {
        return null;
      }
      return r;
    }

    private String peek() {
      return pos < toks.size() ? toks.get(pos).text : null;
    }

    private Map<String, Long> expr() {
      Map<String, Long> acc = term();
      while (acc != null && ("+".equals(peek()) || "-".equals(peek()))) {
        long sign = toks.get(pos++).text.equals("+") ? 1 : -1;
        Map<String, Long> rhs = term();
        if (rhs == null) {
          return null;
        }
        for (Map.Entry<String, Long> e: rhs.entrySet()) {
          acc.put(e.getKey(), coeff(acc, e.getKey()) + sign * e.getValue());
        }
      }
      return acc;
    }

    private Map<String, Long> term() {
      Map<String, Long> acc = factor();
      while (acc != null && "*".equals(peek())) {
        pos++;
        Map<String, Long> rhs = factor();
        if (rhs == null) {
          return null;
        }
        if (isConst(acc)) {
          acc = scale(rhs, coeff(acc, CONST));
        } else if (isConst(rhs)) {
          acc = scale(acc, coeff(rhs, CONST));
        } else {
          // Not affine
          return null;
        }
      }
      return acc;
    }

    private Map<String, Long> factor() {
      String t = peek();
      if (t == null) {
        return null;
      }
      Map<String, Long> r = new HashMap<String, Long>();
      if (t.equals("-")) {
        pos++;
        Map<String, Long> f = factor();
        return f == null ? null : scale(f, -1);
      } else if (t.equals("(")) {
        pos++;
        Map<String, Long> e = expr();
        if (e == null || !")".equals(peek())) {
          return null;
        }
        pos++;
        return e;
      }
      Token tok = toks.get(pos);
      if (tok.kind == TokenKind.NUMBER && isInteger(tok.text)) {
        pos++;
        r.put(CONST, Long.parseLong(tok.text));
        return r;
      } else if (tok.kind == TokenKind.IDENT && !KEYWORDS.contains(tok.text)) {
        pos++;
        r.put(tok.text, 1L);
        return r;
      }
      return null;
    }

    private static boolean isConst(Map<String, Long> f) {
      for (Map.Entry<String, Long> e: f.entrySet()) {
        if (!e.getKey().equals(CONST) && e.getValue() != 0) {
          return false;
        }
      }
      return true;
    }

    private static Map<String, Long> scale(Map<String, Long> f, long k) {
      Map<String, Long> r = new HashMap<String, Long>();
      for (Map.Entry<String, Long> e: f.entrySet()) {
        r.put(e.getKey(), e.getValue() * k);
      }
      return r;
    }
  }
}
