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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * A rectangular set of indices into a data container, one range per
 * dimension.
 *
 * Written as "b:e:s" per dimension with an exclusive end, or a single
 * index expression "i" for a one-element dimension.
 */
public class Subset {

  public static class Range {
    public final String begin;
    /** Exclusive end */
    public final String end;
    public final String step;
    /** True if written as a single index */
    public final boolean index;

    public Range(String begin, String end, String step) {
      this(begin, end, step, false);
    }

    private Range(String begin, String end, String step, boolean index) {
      this.begin = begin.trim();
      this.end = end.trim();
      this.step = step.trim();
      this.index = index;
    }

    public static Range index(String i) {
      return new Range(i, i.trim() + " + 1", "1", true);
    }

    public Range replace(Map<String, String> repl) {
      if (index) {
        return index(Symbolic.replaceSymbols(begin, repl));
      }
      return new Range(Symbolic.replaceSymbols(begin, repl),
                       Symbolic.replaceSymbols(end, repl),
                       Symbolic.replaceSymbols(step, repl));
    }

    public Set<String> freeSymbols() {
      Set<String> res = new LinkedHashSet<String>();
      res.addAll(Symbolic.freeSymbols(begin));
      res.addAll(Symbolic.freeSymbols(end));
      res.addAll(Symbolic.freeSymbols(step));
      return res;
    }

    /**
     * Whether this range provably contains every index of other.  Strided
     * ranges are only compared when both have the same step.
     */
    public boolean covers(Range other) {
      if (!step.equals("1") && !step.equals(other.step)) {
        return false;
      }
      return Symbolic.provablyLessEqual(begin, other.begin) &&
             Symbolic.provablyLessEqual(other.end, end);
    }

    @Override
    public String toString() {
      if (index) {
        return begin;
      } else if (step.equals("1")) {
        return begin + ":" + end;
      }
      return begin + ":" + end + ":" + step;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Range)) {
        return false;
      }
      Range r = (Range)o;
      return begin.equals(r.begin) && end.equals(r.end) &&
             step.equals(r.step);
    }

    @Override
    public int hashCode() {
      return (begin.hashCode() * 31 + end.hashCode()) * 31 + step.hashCode();
    }
  }

  private final List<Range> ranges;

  public Subset(List<Range> ranges) {
    this.ranges = Collections.unmodifiableList(new ArrayList<Range>(ranges));
  }

  public List<Range> ranges() {
    return ranges;
  }

  public int dims() {
    return ranges.size();
  }

  /**
   * The whole of a container with the given shape
   */
  public static Subset full(List<String> shape) {
    List<Range> rs = new ArrayList<Range>();
    for (String dim: shape) {
      rs.add(new Range("0", dim, "1"));
    }
    return new Subset(rs);
  }

  /**
   * Parse e.g. "0:N, i, 0:M:2".  Commas nested in brackets are not
   * treated as separators.
   */
  public static Subset fromString(String s) {
    List<Range> rs = new ArrayList<Range>();
    for (String dim: splitTopLevel(s, ',')) {
      List<String> parts = splitTopLevel(dim, ':');
      if (parts.size() == 1) {
        rs.add(Range.index(parts.get(0)));
      } else if (parts.size() == 2) {
        rs.add(new Range(parts.get(0), parts.get(1), "1"));
      } else if (parts.size() == 3) {
        rs.add(new Range(parts.get(0), parts.get(1), parts.get(2)));
      } else {
        throw new IllegalArgumentException("Bad subset dimension: " + dim);
      }
    }
    return new Subset(rs);
  }

  private static List<String> splitTopLevel(String s, char sep) {
    List<String> parts = new ArrayList<String>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '(' || c == '[') {
        depth++;
      } else if (c == ')' || c == ']') {
        depth--;
      } else if (c == sep && depth == 0) {
        parts.add(s.substring(start, i).trim());
        start = i + 1;
      }
    }
    String last = s.substring(start).trim();
    if (last.length() > 0 || !parts.isEmpty()) {
      parts.add(last);
    }
    return parts;
  }

  /**
   * Whether every index in other is provably also in this subset.
   * Returns false when it cannot be shown.
   */
  public boolean covers(Subset other) {
    if (other == null || other.dims() != dims()) {
      return false;
    }
    for (int i = 0; i < ranges.size(); i++) {
      if (!ranges.get(i).covers(other.ranges.get(i))) {
        return false;
      }
    }
    return true;
  }

  public Set<String> freeSymbols() {
    Set<String> res = new LinkedHashSet<String>();
    for (Range r: ranges) {
      res.addAll(r.freeSymbols());
    }
    return res;
  }

  public Subset replace(Map<String, String> repl) {
    List<Range> rs = new ArrayList<Range>();
    for (Range r: ranges) {
      rs.add(r.replace(repl));
    }
    return new Subset(rs);
  }

  @Override
  public String toString() {
    return StringUtils.join(ranges, ", ");
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Subset && ranges.equals(((Subset)o).ranges);
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }
}
