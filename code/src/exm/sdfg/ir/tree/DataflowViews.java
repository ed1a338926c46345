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
package exm.sdfg.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import exm.sdfg.common.Logging;
import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.lang.AllocationLifetime;
import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.Symbolic;
import exm.sdfg.ir.graph.OrderedDiGraph;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.Language;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;

/**
 * Algorithms shared by full states and subgraph views of states.
 * Memlet tracing always works on the full state, since paths can leave
 * the view.
 */
public class DataflowViews {

  private static final Logger logger = Logging.getSDFGLogger();

  /** Containers and symbols with this prefix are internal, never arguments */
  public static final String RESERVED_PREFIX = "__sdfg";

  public static List<List<Node>> findCycles(DataflowGraphView view) {
    OrderedDiGraph<Node, MemletEdge> g = new OrderedDiGraph<Node, MemletEdge>();
    for (Node n: view.nodes()) {
      g.addNode(n);
    }
    for (MemletEdge e: view.edges()) {
      g.addEdge(e);
    }
    return g.findCycles();
  }

  public static List<AccessNode> dataNodes(DataflowGraphView view) {
    List<AccessNode> res = new ArrayList<AccessNode>();
    for (Node n: view.nodes()) {
      if (n.isAccessNode()) {
        res.add((AccessNode)n);
      }
    }
    return res;
  }

  ///////////////////////////////////////////////////////////////////
  // Memlet tracking

  private static String connId(String conn, String prefix) {
    return conn.substring(prefix.length());
  }

  private static MemletEdge findIn(SDFGState state, Node node, String conn) {
    for (MemletEdge e: state.inEdges(node)) {
      if (conn.equals(e.dstConn())) {
        return e;
      }
    }
    throw new InvalidGraphException("No edge into connector " + conn +
                                    " of " + node.getLabel());
  }

  private static MemletEdge findOut(SDFGState state, Node node, String conn) {
    for (MemletEdge e: state.outEdges(node)) {
      if (conn.equals(e.srcConn())) {
        return e;
      }
    }
    throw new InvalidGraphException("No edge out of connector " + conn +
                                    " of " + node.getLabel());
  }

  private static boolean endsPath(Node n) {
    return n.isAccessNode() || n.isCodeNode();
  }

  /**
   * Extend an edge through scope entries and exits to the source and sink
   * it ultimately connects.  If several paths go through the edge, the
   * first matching edge is followed at each step.
   */
  public static List<MemletEdge> memletPath(DataflowGraphView view,
                                            MemletEdge edge) {
    List<MemletEdge> result = new ArrayList<MemletEdge>();
    result.add(edge);
    SDFGState state = view.state();

    if (edge.srcConn() == null && edge.dstConn() == null &&
        edge.data().isEmpty()) {
      return result;
    }

    // Prepend incoming edges until reaching the source
    MemletEdge cur = edge;
    Set<MemletEdge> visited = new HashSet<MemletEdge>();
    while (!endsPath(cur.src())) {
      visited.add(cur);
      if (cur.srcConn() == null) {
        throw new InvalidGraphException("Source connector cannot be null " +
                                        "for " + cur.src().getLabel());
      }
      if (!cur.srcConn().startsWith(Nodes.OUT_PREFIX)) {
        throw new InvalidGraphException("Expected " + Nodes.OUT_PREFIX +
            " connector on " + cur.src().getLabel() + ", got " + cur.srcConn());
      }
      cur = findIn(state, cur.src(),
                   Nodes.IN_PREFIX + connId(cur.srcConn(), Nodes.OUT_PREFIX));
      result.add(0, cur);
      if (visited.contains(cur)) {
        throw new InvalidGraphException("Cycle encountered while reading " +
                                        "memlet path");
      }
    }

    // Append outgoing edges until reaching the sink
    cur = edge;
    visited.clear();
    while (!endsPath(cur.dst())) {
      visited.add(cur);
      if (cur.dstConn() == null) {
        throw new InvalidGraphException("Destination connector cannot be " +
                                        "null for " + cur.dst().getLabel());
      }
      if (!cur.dstConn().startsWith(Nodes.IN_PREFIX)) {
        // Not a pass-through connector, e.g. a dynamic map range input
        break;
      }
      cur = findOut(state, cur.dst(),
                    Nodes.OUT_PREFIX + connId(cur.dstConn(), Nodes.IN_PREFIX));
      result.add(cur);
      if (visited.contains(cur)) {
        throw new InvalidGraphException("Cycle encountered while reading " +
                                        "memlet path");
      }
    }
    return result;
  }

  public static MemletTree memletTree(DataflowGraphView view,
                                      MemletEdge edge) {
    boolean forward =
        (edge.src().isScopeEntry() && edge.srcConn() != null) ||
        (edge.dst().isScopeEntry() && edge.dstConn() != null &&
         edge.dstConn().startsWith(Nodes.IN_PREFIX));
    boolean backward =
        (edge.src().isScopeExit() && edge.srcConn() != null) ||
        (edge.dst().isScopeExit() && edge.dstConn() != null);

    // Neither: no scopes involved.  Both: malformed.  Either way the edge
    // is a tree on its own.
    if (forward == backward) {
      return new MemletTree(edge);
    }

    SDFGState state = view.state();

    // Find the root
    MemletEdge cur = edge;
    Set<MemletEdge> visited = new HashSet<MemletEdge>();
    if (forward) {
      while (cur.src().isScopeEntry() && cur.srcConn() != null) {
        visited.add(cur);
        if (!cur.srcConn().startsWith(Nodes.OUT_PREFIX)) {
          throw new InvalidGraphException("Bad connector " + cur.srcConn() +
                                " on scope entry " + cur.src().getLabel());
        }
        cur = findIn(state, cur.src(),
                     Nodes.IN_PREFIX + connId(cur.srcConn(), Nodes.OUT_PREFIX));
        if (visited.contains(cur)) {
          throw new InvalidGraphException("Cycle encountered while reading " +
                                          "memlet path");
        }
      }
    } else {
      while (cur.dst().isScopeExit() && cur.dstConn() != null) {
        visited.add(cur);
        if (!cur.dstConn().startsWith(Nodes.IN_PREFIX)) {
          throw new InvalidGraphException("Bad connector " + cur.dstConn() +
                                " on scope exit " + cur.dst().getLabel());
        }
        cur = findOut(state, cur.dst(),
                      Nodes.OUT_PREFIX + connId(cur.dstConn(), Nodes.IN_PREFIX));
        if (visited.contains(cur)) {
          throw new InvalidGraphException("Cycle encountered while reading " +
                                          "memlet path");
        }
      }
    }

    MemletTree root = new MemletTree(cur, forward, null);
    addTreeChildren(state, root, forward);

    for (MemletTree t: root.traverseChildren(true)) {
      if (t.edge() == edge) {
        return t;
      }
    }
    throw new InvalidGraphException("Edge " + edge + " not in its own " +
                                    "memlet tree");
  }

  private static void addTreeChildren(SDFGState state, MemletTree node,
                                      boolean forward) {
    MemletEdge e = node.edge();
    if (forward) {
      if (!(e.dst().isScopeEntry() && e.dstConn() != null &&
            e.dstConn().startsWith(Nodes.IN_PREFIX))) {
        return;
      }
      String conn = Nodes.OUT_PREFIX + connId(e.dstConn(), Nodes.IN_PREFIX);
      for (MemletEdge child: state.outEdges(e.dst())) {
        if (conn.equals(child.srcConn())) {
          node.addChild(new MemletTree(child, true, node));
        }
      }
    } else {
      if (!e.src().isScopeExit() || e.srcConn() == null) {
        return;
      }
      String conn = Nodes.IN_PREFIX + connId(e.srcConn(), Nodes.OUT_PREFIX);
      for (MemletEdge child: state.inEdges(e.src())) {
        if (conn.equals(child.dstConn())) {
          node.addChild(new MemletTree(child, false, node));
        }
      }
    }
    for (MemletTree child: node.children()) {
      addTreeChildren(state, child, forward);
    }
  }

  public static List<MemletEdge> inEdgesByConnector(DataflowGraphView view,
                                        Node node, String connector) {
    List<MemletEdge> res = new ArrayList<MemletEdge>();
    for (MemletEdge e: view.inEdges(node)) {
      if (connector.equals(e.dstConn())) {
        res.add(e);
      }
    }
    return res;
  }

  public static List<MemletEdge> outEdgesByConnector(DataflowGraphView view,
                                        Node node, String connector) {
    List<MemletEdge> res = new ArrayList<MemletEdge>();
    for (MemletEdge e: view.outEdges(node)) {
      if (connector.equals(e.srcConn())) {
        res.add(e);
      }
    }
    return res;
  }

  public static List<MemletEdge> edgesByConnector(DataflowGraphView view,
                                        Node node, String connector) {
    List<MemletEdge> res = inEdgesByConnector(view, node, connector);
    res.addAll(outEdgesByConnector(view, node, connector));
    return res;
  }

  public static boolean isLeafMemlet(MemletEdge e) {
    if (e.src().isScopeExit() && e.srcConn() != null &&
        e.srcConn().startsWith(Nodes.OUT_PREFIX)) {
      return false;
    }
    if (e.dst().isScopeEntry() && e.dstConn() != null &&
        e.dstConn().startsWith(Nodes.IN_PREFIX)) {
      return false;
    }
    return true;
  }

  ///////////////////////////////////////////////////////////////////
  // Symbols

  private static Map<String, Data> arrays(SDFG sdfg) {
    if (sdfg == null) {
      return Collections.emptyMap();
    }
    return sdfg.arrays();
  }

  private static Map<String, DType> symbols(SDFG sdfg) {
    if (sdfg == null) {
      return Collections.emptyMap();
    }
    return sdfg.symbols();
  }

  private static Map<String, String> constants(SDFG sdfg) {
    if (sdfg == null) {
      return Collections.emptyMap();
    }
    return sdfg.constants();
  }

  public static Set<String> usedSymbols(DataflowGraphView view,
                                        boolean allSymbols) {
    SDFG sdfg = view.sdfg();
    Set<String> newSymbols = new HashSet<String>();
    Set<String> freeSyms = new LinkedHashSet<String>();

    for (Node n: view.nodes()) {
      if (n.isScopeEntry()) {
        newSymbols.addAll(((EntryNode)n).newSymbols());
      } else if (n.isAccessNode()) {
        Data desc = arrays(sdfg).get(((AccessNode)n).data());
        if (desc != null) {
          freeSyms.addAll(desc.usedSymbols(allSymbols));
        }
      } else if (n instanceof Tasklet) {
        Tasklet t = (Tasklet)n;
        if (t.language() == Language.PYTHON) {
          // Callbacks declared as symbols are free too
          for (String called: Symbolic.calledNames(t.code())) {
            if (symbols(sdfg).containsKey(called)) {
              freeSyms.add(called);
            }
          }
        } else {
          freeSyms.addAll(Symbolic.symbolsInCode(t.code(),
                          symbols(sdfg).keySet(), t.connectorNames()));
          continue;
        }
      }
      freeSyms.addAll(n.usedSymbols(allSymbols));
    }

    for (MemletEdge e: view.edges()) {
      // Code generation only needs the innermost memlets
      if (!allSymbols && !isLeafMemlet(e)) {
        continue;
      }
      freeSyms.addAll(e.data().usedSymbols(allSymbols));
    }

    newSymbols.addAll(constants(sdfg).keySet());
    freeSyms.removeAll(newSymbols);
    return freeSyms;
  }

  private static void putIfAbsent(Map<String, DType> m, String sym) {
    if (!m.containsKey(sym)) {
      m.put(sym, Settings.getDefaultSymbolType());
    }
  }

  /**
   * Symbols visible everywhere in the state: declared symbols, symbols in
   * container shapes, symbols assigned on transitions and loop variables.
   */
  private static Map<String, DType> stateLevelSymbols(SDFG sdfg) {
    Map<String, DType> defined = new LinkedHashMap<String, DType>();
    if (sdfg == null) {
      return defined;
    }
    defined.putAll(sdfg.symbols());
    for (Data desc: sdfg.arrays().values()) {
      for (String sym: desc.usedSymbols(true)) {
        putIfAbsent(defined, sym);
      }
    }
    for (ControlFlowEdge e: sdfg.allInterstateEdges(false)) {
      for (String sym: e.data().newSymbols()) {
        putIfAbsent(defined, sym);
      }
    }
    for (ControlFlowRegion r: sdfg.allControlFlowRegions(false)) {
      if (r instanceof LoopRegion) {
        String var = ((LoopRegion)r).loopVariable();
        if (var.length() > 0) {
          putIfAbsent(defined, var);
        }
      }
    }
    return defined;
  }

  public static Map<String, DType> definedSymbols(DataflowGraphView view) {
    Map<String, DType> defined = stateLevelSymbols(view.sdfg());

    // Scope symbols, from the outermost scope around the view inwards
    Map<Node, EntryNode> sdict = view.state().scopeDict();
    List<EntryNode> scopeNodes = new ArrayList<EntryNode>();
    for (Node source: view.sourceNodes()) {
      EntryNode cur = sdict.get(source);
      while (cur != null) {
        scopeNodes.add(cur);
        cur = sdict.get(cur);
      }
    }
    Collections.reverse(scopeNodes);
    for (EntryNode entry: new LinkedHashSet<EntryNode>(scopeNodes)) {
      for (String sym: entry.newSymbols()) {
        putIfAbsent(defined, sym);
      }
    }
    return defined;
  }

  public static Map<String, DType> symbolsDefinedAt(SDFGState state,
                                                    Node node) {
    if (node == null) {
      return new LinkedHashMap<String, DType>();
    }
    Map<String, DType> defined = stateLevelSymbols(state.sdfg());
    Map<Node, EntryNode> sdict = state.scopeDict();
    List<EntryNode> scopes = new ArrayList<EntryNode>();
    EntryNode cur = sdict.get(node);
    while (cur != null) {
      scopes.add(cur);
      cur = sdict.get(cur);
    }
    Collections.reverse(scopes);
    for (EntryNode entry: scopes) {
      for (String sym: entry.newSymbols()) {
        putIfAbsent(defined, sym);
      }
    }
    return defined;
  }

  ///////////////////////////////////////////////////////////////////
  // Read and write sets

  /**
   * Split a view into parts that share no data dependency and can run
   * concurrently.  Source access nodes may be shared between parts.
   */
  public static List<StateSubgraphView> concurrentSubgraphs(
                                          DataflowGraphView view) {
    Map<Node, Set<Node>> components = new LinkedHashMap<Node, Set<Node>>();
    for (Node cand: view.sourceNodes()) {
      if (cand.isAccessNode()) {
        // Data can be read by several components
        for (MemletEdge e: view.outEdges(cand)) {
          Set<Node> c = components.get(e.dst());
          if (c == null) {
            c = new HashSet<Node>();
            c.add(e.dst());
            components.put(e.dst(), c);
          }
          c.add(cand);
        }
      } else {
        Set<Node> c = new HashSet<Node>();
        c.add(cand);
        components.put(cand, c);
      }
    }

    List<Set<Node>> subgraphs = new ArrayList<Set<Node>>();
    for (Map.Entry<Node, Set<Node>> comp: components.entrySet()) {
      Set<Node> seen = new HashSet<Node>();
      List<Node> toSearch = new ArrayList<Node>();
      toSearch.add(comp.getKey());
      while (!toSearch.isEmpty()) {
        Node n = toSearch.remove(toSearch.size() - 1);
        if (!seen.add(n)) {
          continue;
        }
        for (MemletEdge e: view.outEdges(n)) {
          if (!seen.contains(e.dst())) {
            toSearch.add(e.dst());
          }
        }
      }

      // Fuse with the first overlapping component
      boolean fused = false;
      for (Set<Node> other: subgraphs) {
        if (!Collections.disjoint(other, seen)) {
          other.addAll(seen);
          other.addAll(comp.getValue());
          fused = true;
          break;
        }
      }
      if (!fused) {
        seen.addAll(comp.getValue());
        subgraphs.add(seen);
      }
    }

    List<StateSubgraphView> result = new ArrayList<StateSubgraphView>();
    for (Set<Node> sg: subgraphs) {
      result.add(new StateSubgraphView(view.state(), sg));
    }
    return result;
  }

  /**
   * @return (container to subsets read, container to subsets written)
   */
  public static Pair<Map<String, List<Subset>>, Map<String, List<Subset>>>
                          readAndWriteSubsets(DataflowGraphView view) {
    Map<String, List<Subset>> readSet = new TreeMap<String, List<Subset>>();
    Map<String, List<Subset>> writeSet = new TreeMap<String, List<Subset>>();

    for (StateSubgraphView sg: concurrentSubgraphs(view)) {
      // Topological order, so a write is seen before reads that follow it
      for (Node n: sg.topologicalSort()) {
        if (!n.isAccessNode()) {
          continue;
        }
        String data = ((AccessNode)n).data();
        List<MemletEdge> inEdges = sg.inEdges(n);
        List<MemletEdge> outEdges = sg.outEdges(n);

        // Reads of data this node was just given are not external reads
        List<MemletEdge> reads = new ArrayList<MemletEdge>();
        for (MemletEdge out: outEdges) {
          boolean masked = false;
          for (MemletEdge in: inEdges) {
            if (in.data().data() != null &&
                in.data().data().equals(out.data().data()) &&
                in.data().subset() != null &&
                in.data().subset().covers(out.data().subset())) {
              masked = true;
              break;
            }
          }
          if (!masked) {
            reads.add(out);
          }
        }

        for (MemletEdge e: inEdges) {
          if (!e.data().isEmpty()) {
            addSubset(writeSet, data, e.data().subset());
          }
        }
        for (MemletEdge e: reads) {
          if (!e.data().isEmpty()) {
            addSubset(readSet, data, e.data().subset());
          }
        }
      }
    }
    return Pair.of(readSet, writeSet);
  }

  private static void addSubset(Map<String, List<Subset>> m, String data,
                                Subset subset) {
    List<Subset> l = m.get(data);
    if (l == null) {
      l = new ArrayList<Subset>();
      m.put(data, l);
    }
    l.add(subset);
  }

  public static Pair<Set<String>, Set<String>> readAndWriteSets(
                                          DataflowGraphView view) {
    Pair<Map<String, List<Subset>>, Map<String, List<Subset>>> rw =
                                            readAndWriteSubsets(view);
    return Pair.<Set<String>, Set<String>>of(
                new LinkedHashSet<String>(rw.getLeft().keySet()),
                new LinkedHashSet<String>(rw.getRight().keySet()));
  }

  ///////////////////////////////////////////////////////////////////
  // Arguments

  private static Data lookupDesc(SDFG sdfg, String name) {
    Data desc = arrays(sdfg).get(name);
    if (desc == null) {
      throw new InvalidGraphException("Container " + name +
                                      " is not registered");
    }
    return desc;
  }

  public static Pair<Map<String, Data>, Map<String, Data>> unorderedArgList(
        DataflowGraphView view, Map<String, DType> definedSyms,
        Set<String> sharedTransients) {
    SDFG sdfg = view.sdfg();
    if (sharedTransients == null) {
      sharedTransients = sdfg == null ? Collections.<String>emptySet()
                                      : sdfg.sharedTransients();
    }
    Map<Node, EntryNode> sdict = view.scopeDict();

    Map<String, Data> dataArgs = new LinkedHashMap<String, Data>();
    Map<String, Data> scalarArgs = new LinkedHashMap<String, Data>();

    Map<String, Data> descs = new LinkedHashMap<String, Data>();
    Map<String, AccessNode> descsWithNodes =
                        new LinkedHashMap<String, AccessNode>();
    for (AccessNode n: view.dataNodes()) {
      descs.put(n.data(), lookupDesc(sdfg, n.data()));
      descsWithNodes.put(n.data(), n);
    }

    // Data also accessed outside a subgraph is allocated outside it
    if (view.isSubgraph()) {
      for (Node n: view.state().nodes()) {
        if (!view.containsNode(n) && n.isAccessNode()) {
          String name = ((AccessNode)n).data();
          Data desc = descs.get(name);
          if (desc == null) {
            continue;
          }
          if (desc.isScalar()) {
            scalarArgs.put(name, desc);
          } else {
            dataArgs.put(name, desc);
          }
        }
      }
    }

    // Data only reached through edges comes from outside
    for (MemletEdge e: view.edges()) {
      String name = e.data().data();
      if (name == null || descs.containsKey(name)) {
        continue;
      }
      Data desc = lookupDesc(sdfg, name);
      if (desc.isScalar()) {
        // Code to code edges are not arguments
        if (e.src().isCodeNode() && e.dst().isCodeNode()) {
          continue;
        }
        scalarArgs.put(name, desc);
      } else {
        dataArgs.put(name, desc);
      }
    }

    for (Map.Entry<String, Data> d: descs.entrySet()) {
      String name = d.getKey();
      Data desc = d.getValue();
      if (dataArgs.containsKey(name) || scalarArgs.containsKey(name)) {
        continue;
      }
      if (!desc.isTransient()) {
        dataArgs.put(name, desc);
      } else if (sharedTransients.contains(name)) {
        dataArgs.put(name, desc);
      } else if (!view.isSubgraph()) {
        if (desc.lifetime() != AllocationLifetime.SCOPE &&
            desc.lifetime() != AllocationLifetime.STATE) {
          dataArgs.put(name, desc);
        }
      } else if (desc.lifetime() != AllocationLifetime.SCOPE) {
        dataArgs.put(name, desc);
      } else {
        // External unless some scope inside the subgraph can allocate it
        EntryNode cur = sdict.get(descsWithNodes.get(name));
        while (cur != null &&
               !desc.storage().canAllocateIn(cur.schedule())) {
          cur = sdict.get(cur);
        }
        if (cur == null) {
          dataArgs.put(name, desc);
        }
      }
    }

    // Free symbols become scalar arguments
    if (definedSyms == null) {
      definedSyms = view.definedSymbols();
    }
    for (String sym: view.usedSymbols(false, false)) {
      if (sym.startsWith(RESERVED_PREFIX) ||
          constants(sdfg).containsKey(sym)) {
        continue;
      }
      if (definedSyms.containsKey(sym)) {
        scalarArgs.put(sym, Data.scalar(definedSyms.get(sym)));
      } else if (arrays(sdfg).containsKey(sym)) {
        scalarArgs.put(sym, arrays(sdfg).get(sym));
      } else {
        logger.debug("No definition for symbol " + sym + " in " +
                     view.getLabel() + ", assuming external scalar");
        scalarArgs.put(sym, Data.scalar(Settings.getDefaultSymbolType()));
      }
    }

    // And so do symbols in the shapes of data arguments
    for (Data arg: dataArgs.values()) {
      for (String sym: arg.usedSymbols(false)) {
        if (sym.startsWith(RESERVED_PREFIX) ||
            constants(sdfg).containsKey(sym)) {
          continue;
        }
        DType t = definedSyms.get(sym);
        scalarArgs.put(sym, Data.scalar(t != null ? t :
                                        Settings.getDefaultSymbolType()));
      }
    }

    return Pair.of(dataArgs, scalarArgs);
  }

  /**
   * Data arguments sorted by name, then scalar arguments sorted by name
   */
  public static LinkedHashMap<String, Data> sortArgs(
                          Pair<Map<String, Data>, Map<String, Data>> args) {
    LinkedHashMap<String, Data> result = new LinkedHashMap<String, Data>();
    result.putAll(new TreeMap<String, Data>(args.getLeft()));
    for (Map.Entry<String, Data> e:
                  new TreeMap<String, Data>(args.getRight()).entrySet()) {
      if (!result.containsKey(e.getKey())) {
        result.put(e.getKey(), e.getValue());
      }
    }
    return result;
  }

  public static List<String> signatureArgList(BlockGraphView view,
                                      boolean withTypes, boolean forCall) {
    List<String> res = new ArrayList<String>();
    for (Map.Entry<String, Data> e: view.argList().entrySet()) {
      res.add(e.getValue().asArg(e.getKey(), withTypes, forCall));
    }
    return res;
  }

  ///////////////////////////////////////////////////////////////////
  // Transients and renaming

  public static Set<String> topLevelTransients(DataflowGraphView view) {
    Set<String> res = new LinkedHashSet<String>();
    List<Node> top = view.scopeChildren().get(null);
    if (top == null) {
      return res;
    }
    for (Node n: top) {
      if (n.isAccessNode()) {
        Data desc = arrays(view.sdfg()).get(((AccessNode)n).data());
        if (desc != null && desc.isTransient()) {
          res.add(((AccessNode)n).data());
        }
      }
    }
    return res;
  }

  public static List<String> allTransients(DataflowGraphView view) {
    Set<String> res = new LinkedHashSet<String>();
    for (AccessNode n: view.dataNodes()) {
      Data desc = arrays(view.sdfg()).get(n.data());
      if (desc != null && desc.isTransient()) {
        res.add(n.data());
      }
    }
    return new ArrayList<String>(res);
  }

  public static void replaceDict(DataflowGraphView view,
                                 Map<String, String> repl) {
    for (Node n: view.nodes()) {
      n.replace(repl);
    }
    for (MemletEdge e: view.edges()) {
      e.data().replace(repl);
    }
  }
}
