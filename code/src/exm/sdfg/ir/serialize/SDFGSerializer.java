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
package exm.sdfg.ir.serialize;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.sdfg.common.Logging;
import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.exceptions.SerializationException;
import exm.sdfg.common.lang.AllocationLifetime;
import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.common.lang.Data.DataKind;
import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.StorageType;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.Subset.Range;
import exm.sdfg.ir.tree.ControlFlowBlock;
import exm.sdfg.ir.tree.ControlFlowEdge;
import exm.sdfg.ir.tree.ControlFlowRegion;
import exm.sdfg.ir.tree.FunctionCallRegion;
import exm.sdfg.ir.tree.InterstateEdge;
import exm.sdfg.ir.tree.LoopRegion;
import exm.sdfg.ir.tree.Memlet;
import exm.sdfg.ir.tree.MemletEdge;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.Language;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.MapScope;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;
import exm.sdfg.ir.tree.Terminators.BreakBlock;
import exm.sdfg.ir.tree.Terminators.ContinueBlock;
import exm.sdfg.ir.tree.Terminators.ReturnBlock;
import exm.sdfg.ir.tree.UserRegion;

/**
 * Converts graphs to and from JSON documents.  Blocks and nodes are typed
 * records; edges refer to their endpoints by index in the enclosing
 * "nodes" list.
 */
public class SDFGSerializer {

  private static final Logger logger = Logging.getSDFGLogger();

  /** Key of top-level nodes in scope_dict */
  private static final int TOP_LEVEL = -1;

  private final ObjectMapper mapper;

  public SDFGSerializer() {
    this.mapper = new ObjectMapper();
    if (Settings.getBooleanUnchecked(Settings.SERIALIZE_PRETTY)) {
      mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }
  }

  public String toJson(SDFG sdfg) throws SerializationException {
    try {
      return mapper.writeValueAsString(toTree(sdfg));
    } catch (JsonProcessingException e) {
      throw new SerializationException("Could not write " + sdfg.getLabel(),
                                       e);
    }
  }

  public SDFG fromJson(String json) throws SerializationException {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Malformed JSON document: " +
                                       e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new SerializationException("Document is not a JSON object");
    }
    try {
      return readSDFG(root);
    } catch (InvalidGraphException e) {
      throw new SerializationException("Document describes an invalid " +
                                       "graph: " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Bad value in document: " +
                                       e.getMessage(), e);
    }
  }

  public void save(SDFG sdfg, File file)
                  throws IOException, SerializationException {
    FileUtils.writeStringToFile(file, toJson(sdfg), StandardCharsets.UTF_8);
    logger.debug("Wrote " + sdfg.getLabel() + " to " + file);
  }

  public SDFG load(File file) throws IOException, SerializationException {
    logger.debug("Loading " + file);
    return fromJson(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
  }

  ///////////////////////////////////////////////////////////////////
  // Writing

  public ObjectNode toTree(SDFG sdfg) {
    ObjectNode o = writeRegion(sdfg);
    ObjectNode arrays = o.putObject("arrays");
    for (Map.Entry<String, Data> e: sdfg.arrays().entrySet()) {
      arrays.set(e.getKey(), writeData(e.getValue()));
    }
    ObjectNode symbols = o.putObject("symbols");
    for (Map.Entry<String, DType> e: sdfg.symbols().entrySet()) {
      symbols.put(e.getKey(), e.getValue().toString());
    }
    ObjectNode constants = o.putObject("constants");
    for (Map.Entry<String, String> e: sdfg.constants().entrySet()) {
      constants.put(e.getKey(), e.getValue());
    }
    return o;
  }

  private ObjectNode writeData(Data d) {
    ObjectNode o = mapper.createObjectNode();
    o.put("kind", d.kind().name());
    o.put("dtype", d.dtype().toString());
    ArrayNode shape = o.putArray("shape");
    for (String dim: d.shape()) {
      shape.add(dim);
    }
    o.put("storage", d.storage().name());
    o.put("transient", d.isTransient());
    o.put("lifetime", d.lifetime().name());
    return o;
  }

  private ObjectNode writeBlock(ControlFlowBlock block) {
    switch (block.getType()) {
      case STATE:
        return writeState((SDFGState)block);
      case REGION:
      case LOOP:
      case USER_REGION:
      case FUNCTION_CALL:
        return writeRegion((ControlFlowRegion)block);
      case BREAK:
      case CONTINUE:
      case RETURN:
        ObjectNode o = mapper.createObjectNode();
        o.put("type", typeName(block));
        o.put("label", block.getLabel());
        return o;
      default:
        throw new InvalidGraphException("Cannot serialize block " +
                      block.getLabel() + " of type " + block.getType());
    }
  }

  private static String typeName(ControlFlowBlock block) {
    switch (block.getType()) {
      case STATE: return "SDFGState";
      case REGION: return "ControlFlowRegion";
      case LOOP: return "LoopRegion";
      case USER_REGION: return "UserRegion";
      case FUNCTION_CALL: return "FunctionCallRegion";
      case BREAK: return "BreakBlock";
      case CONTINUE: return "ContinueBlock";
      case RETURN: return "ReturnBlock";
      case SDFG: return "SDFG";
      default:
        throw new InvalidGraphException("Unknown block type " +
                                        block.getType());
    }
  }

  private ObjectNode writeRegion(ControlFlowRegion region) {
    ObjectNode o = mapper.createObjectNode();
    o.put("type", typeName(region));
    o.put("label", region.getLabel());

    if (region instanceof LoopRegion) {
      LoopRegion loop = (LoopRegion)region;
      o.put("condition", loop.condition());
      o.put("loop_variable", loop.loopVariable());
      o.put("init_statement", loop.initStatement());
      o.put("update_statement", loop.updateStatement());
      o.put("inverted", loop.isInverted());
    } else if (region instanceof UserRegion) {
      o.put("debug_label", ((UserRegion)region).debugLabel());
    } else if (region instanceof FunctionCallRegion) {
      ObjectNode args = o.putObject("arguments");
      for (Map.Entry<String, String> e:
                  ((FunctionCallRegion)region).arguments().entrySet()) {
        args.put(e.getKey(), e.getValue());
      }
    }

    ArrayNode nodes = o.putArray("nodes");
    for (ControlFlowBlock b: region.nodes()) {
      nodes.add(writeBlock(b));
    }
    ArrayNode edges = o.putArray("edges");
    for (ControlFlowEdge e: region.edges()) {
      ObjectNode eo = edges.addObject();
      eo.put("src", region.nodeId(e.src()));
      eo.put("dst", region.nodeId(e.dst()));
      eo.put("condition", e.data().condition());
      ObjectNode assigns = eo.putObject("assignments");
      for (Map.Entry<String, String> a: e.data().assignments().entrySet()) {
        assigns.put(a.getKey(), a.getValue());
      }
    }
    ControlFlowBlock start = region.manualStartBlock();
    if (start == null) {
      o.putNull("start_block");
    } else {
      o.put("start_block", region.nodeId(start));
    }
    o.put("cfg_list_id", region.cfgId());
    return o;
  }

  private ObjectNode writeState(SDFGState state) {
    ObjectNode o = mapper.createObjectNode();
    o.put("type", "SDFGState");
    o.put("label", state.getLabel());
    ArrayNode nodes = o.putArray("nodes");
    for (Node n: state.nodes()) {
      nodes.add(writeNode(state, n));
    }
    ArrayNode edges = o.putArray("edges");
    for (MemletEdge e: state.edges()) {
      ObjectNode eo = edges.addObject();
      eo.put("src", state.nodeId(e.src()));
      eo.put("dst", state.nodeId(e.dst()));
      eo.put("src_connector", e.srcConn());
      eo.put("dst_connector", e.dstConn());
      eo.putObject("attributes").set("data", writeMemlet(e.data()));
    }

    ListMultimap<Integer, Integer> scopes = ArrayListMultimap.create();
    for (Map.Entry<EntryNode, List<Node>> e:
                                  state.scopeChildren().entrySet()) {
      int key = e.getKey() == null ? TOP_LEVEL : state.nodeId(e.getKey());
      for (Node n: e.getValue()) {
        scopes.put(key, state.nodeId(n));
      }
    }
    ObjectNode sd = o.putObject("scope_dict");
    for (Integer key: scopes.keySet()) {
      ArrayNode children = sd.putArray(String.valueOf(key));
      for (Integer child: scopes.get(key)) {
        children.add(child);
      }
    }
    return o;
  }

  private void writeConnectors(ObjectNode o, Node n) {
    ArrayNode in = o.putArray("in_connectors");
    for (String c: n.inConnectors()) {
      in.add(c);
    }
    ArrayNode out = o.putArray("out_connectors");
    for (String c: n.outConnectors()) {
      out.add(c);
    }
  }

  private ObjectNode writeNode(SDFGState state, Node n) {
    ObjectNode o = mapper.createObjectNode();
    o.put("label", n.getLabel());
    switch (n.getType()) {
      case ACCESS:
        o.put("type", "AccessNode");
        o.put("data", ((AccessNode)n).data());
        break;
      case TASKLET:
        Tasklet t = (Tasklet)n;
        o.put("type", "Tasklet");
        o.put("code", t.code());
        o.put("language", t.language().name());
        break;
      case MAP_ENTRY:
        MapScope map = ((MapEntry)n).map();
        o.put("type", "MapEntry");
        ObjectNode mo = o.putObject("map");
        mo.put("label", map.label());
        ObjectNode params = mo.putObject("params");
        for (Map.Entry<String, Range> p: map.params().entrySet()) {
          params.put(p.getKey(), p.getValue().toString());
        }
        mo.put("schedule", map.schedule().name());
        break;
      case MAP_EXIT:
        o.put("type", "MapExit");
        o.put("scope_entry", state.nodeId(findEntry(state, (MapExit)n)));
        break;
      case NESTED_SDFG:
        NestedSDFGNode nn = (NestedSDFGNode)n;
        o.put("type", "NestedSDFG");
        ObjectNode mapping = o.putObject("symbol_mapping");
        for (Map.Entry<String, String> e: nn.symbolMapping().entrySet()) {
          mapping.put(e.getKey(), e.getValue());
        }
        o.set("sdfg", toTree(nn.sdfg()));
        break;
      default:
        throw new InvalidGraphException("Cannot serialize node " +
                                        n.getLabel());
    }
    writeConnectors(o, n);
    return o;
  }

  private static MapEntry findEntry(SDFGState state, MapExit exit) {
    for (Node n: state.nodes()) {
      if (n instanceof MapEntry && ((MapEntry)n).map() == exit.map()) {
        return (MapEntry)n;
      }
    }
    throw new InvalidGraphException("Map exit " + exit.getLabel() +
                    " in state " + state.getLabel() + " has no entry");
  }

  private ObjectNode writeMemlet(Memlet m) {
    ObjectNode o = mapper.createObjectNode();
    o.put("data", m.data());
    o.put("subset", m.subset() == null ? null : m.subset().toString());
    o.put("other_subset", m.otherSubset() == null ? null :
                          m.otherSubset().toString());
    o.put("wcr", m.wcr());
    o.put("dynamic", m.isDynamic());
    return o;
  }

  ///////////////////////////////////////////////////////////////////
  // Reading

  private static JsonNode field(JsonNode o, String name)
                                    throws SerializationException {
    JsonNode v = o.get(name);
    if (v == null) {
      throw new SerializationException("Missing field \"" + name + "\" in " +
                                       describe(o));
    }
    return v;
  }

  private static String text(JsonNode o, String name)
                                    throws SerializationException {
    return field(o, name).asText();
  }

  /**
   * @return the field's text, or null if it is absent or null
   */
  private static String optText(JsonNode o, String name) {
    JsonNode v = o.get(name);
    return (v == null || v.isNull()) ? null : v.asText();
  }

  private static String describe(JsonNode o) {
    JsonNode label = o.get("label");
    JsonNode type = o.get("type");
    return (type == null ? "record" : type.asText()) +
           (label == null ? "" : " " + label.asText());
  }

  private static Map<String, String> stringMap(JsonNode o) {
    Map<String, String> res = new LinkedHashMap<String, String>();
    if (o == null || o.isNull()) {
      return res;
    }
    Iterator<Map.Entry<String, JsonNode>> it = o.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      res.put(e.getKey(), e.getValue().asText());
    }
    return res;
  }

  private static Set<String> stringSet(JsonNode a) {
    Set<String> res = new LinkedHashSet<String>();
    if (a == null || a.isNull()) {
      return res;
    }
    for (JsonNode v: a) {
      res.add(v.asText());
    }
    return res;
  }

  private static DType dtype(String s) throws SerializationException {
    DType t = DType.fromString(s);
    if (t == null) {
      throw new SerializationException("Unknown dtype: " + s);
    }
    return t;
  }

  private SDFG readSDFG(JsonNode o) throws SerializationException {
    SDFG sdfg = new SDFG(text(o, "label"));
    Iterator<Map.Entry<String, JsonNode>> it = field(o, "arrays").fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      sdfg.addDatadesc(e.getKey(), readData(e.getValue()));
    }
    for (Map.Entry<String, String> e: stringMap(o.get("symbols")).entrySet()) {
      sdfg.addSymbol(e.getKey(), dtype(e.getValue()));
    }
    for (Map.Entry<String, String> e:
                          stringMap(o.get("constants")).entrySet()) {
      sdfg.addConstant(e.getKey(), e.getValue());
    }
    readRegionContents(sdfg, o);
    sdfg.resetCfgList();
    return sdfg;
  }

  private Data readData(JsonNode o) throws SerializationException {
    List<String> shape = new ArrayList<String>();
    for (JsonNode dim: field(o, "shape")) {
      shape.add(dim.asText());
    }
    try {
      Data d = new Data(DataKind.valueOf(text(o, "kind")),
                        dtype(text(o, "dtype")), shape);
      d.setStorage(StorageType.fromString(text(o, "storage")));
      d.setTransient(field(o, "transient").asBoolean());
      d.setLifetime(AllocationLifetime.fromString(text(o, "lifetime")));
      return d;
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Bad container descriptor: " +
                                       e.getMessage(), e);
    }
  }

  private ControlFlowBlock readBlock(JsonNode o)
                                    throws SerializationException {
    String type = text(o, "type");
    String label = text(o, "label");
    if (type.equals("SDFGState")) {
      return readState(o);
    } else if (type.equals("ControlFlowRegion")) {
      return readRegionContents(new ControlFlowRegion(label), o);
    } else if (type.equals("LoopRegion")) {
      LoopRegion loop = new LoopRegion(label, optText(o, "condition"),
          optText(o, "loop_variable"), optText(o, "init_statement"),
          optText(o, "update_statement"),
          o.has("inverted") && o.get("inverted").asBoolean());
      return readRegionContents(loop, o);
    } else if (type.equals("UserRegion")) {
      return readRegionContents(
              new UserRegion(label, optText(o, "debug_label")), o);
    } else if (type.equals("FunctionCallRegion")) {
      return readRegionContents(new FunctionCallRegion(label,
                            stringMap(o.get("arguments"))), o);
    } else if (type.equals("BreakBlock")) {
      return new BreakBlock(label);
    } else if (type.equals("ContinueBlock")) {
      return new ContinueBlock(label);
    } else if (type.equals("ReturnBlock")) {
      return new ReturnBlock(label);
    }
    throw new SerializationException("Unknown block type: " + type);
  }

  private ControlFlowRegion readRegionContents(ControlFlowRegion region,
                          JsonNode o) throws SerializationException {
    List<ControlFlowBlock> blocks = new ArrayList<ControlFlowBlock>();
    for (JsonNode n: field(o, "nodes")) {
      blocks.add(region.addNode(readBlock(n)));
    }
    for (JsonNode e: field(o, "edges")) {
      ControlFlowBlock src = blockAt(blocks, e, "src");
      ControlFlowBlock dst = blockAt(blocks, e, "dst");
      region.addEdge(src, dst, new InterstateEdge(optText(e, "condition"),
                                          stringMap(e.get("assignments"))));
    }
    JsonNode start = o.get("start_block");
    if (start != null && !start.isNull()) {
      int id = start.asInt();
      if (id < 0 || id >= blocks.size()) {
        throw new SerializationException("Bad start_block " + id + " in " +
                                         describe(o));
      }
      region.setStartBlock(id);
    }
    return region;
  }

  private static <T> T blockAt(List<T> items, JsonNode e, String key)
                                    throws SerializationException {
    int i = field(e, key).asInt(-1);
    if (i < 0 || i >= items.size()) {
      throw new SerializationException("Edge endpoint " + key + "=" +
                      field(e, key) + " out of range");
    }
    return items.get(i);
  }

  private SDFGState readState(JsonNode o) throws SerializationException {
    SDFGState state = new SDFGState(text(o, "label"));
    JsonNode nodeList = field(o, "nodes");
    int count = nodeList.size();
    Node[] nodes = new Node[count];

    // Exits are built once the entries they share a map with exist
    for (int i = 0; i < count; i++) {
      JsonNode n = nodeList.get(i);
      if (!text(n, "type").equals("MapExit")) {
        nodes[i] = readNode(n);
      }
    }
    for (int i = 0; i < count; i++) {
      JsonNode n = nodeList.get(i);
      if (text(n, "type").equals("MapExit")) {
        int entry = field(n, "scope_entry").asInt(-1);
        if (entry < 0 || entry >= count || !(nodes[entry] instanceof MapEntry)) {
          throw new SerializationException("Map exit " + describe(n) +
                                           " has no valid scope_entry");
        }
        nodes[i] = new MapExit(((MapEntry)nodes[entry]).map());
        readConnectors(nodes[i], n);
      }
    }

    List<Node> ordered = new ArrayList<Node>();
    for (Node n: nodes) {
      ordered.add(state.addNode(n));
    }
    for (JsonNode e: field(o, "edges")) {
      Node src = blockAt(ordered, e, "src");
      Node dst = blockAt(ordered, e, "dst");
      JsonNode attrs = field(e, "attributes");
      state.addEdge(src, optText(e, "src_connector"), dst,
                    optText(e, "dst_connector"),
                    readMemlet(field(attrs, "data")));
    }
    checkScopeDict(state, o.get("scope_dict"));
    return state;
  }

  private Node readNode(JsonNode o) throws SerializationException {
    String type = text(o, "type");
    String label = text(o, "label");
    Node n;
    if (type.equals("AccessNode")) {
      n = new AccessNode(text(o, "data"));
    } else if (type.equals("Tasklet")) {
      Language lang;
      try {
        lang = Language.valueOf(text(o, "language"));
      } catch (IllegalArgumentException e) {
        throw new SerializationException("Bad tasklet language in " +
                                         describe(o), e);
      }
      n = new Tasklet(label, stringSet(o.get("in_connectors")),
            stringSet(o.get("out_connectors")), text(o, "code"), lang);
    } else if (type.equals("MapEntry")) {
      JsonNode mo = field(o, "map");
      LinkedHashMap<String, Range> params = new LinkedHashMap<String, Range>();
      for (Map.Entry<String, String> p:
                            stringMap(field(mo, "params")).entrySet()) {
        Subset s = Subset.fromString(p.getValue());
        if (s.dims() != 1) {
          throw new SerializationException("Bad range for " + p.getKey() +
                                           ": " + p.getValue());
        }
        params.put(p.getKey(), s.ranges().get(0));
      }
      ScheduleType schedule;
      try {
        schedule = ScheduleType.fromString(text(mo, "schedule"));
      } catch (IllegalArgumentException e) {
        throw new SerializationException("Bad schedule in " + describe(o), e);
      }
      n = new MapEntry(new MapScope(text(mo, "label"), params, schedule));
    } else if (type.equals("NestedSDFG")) {
      n = new NestedSDFGNode(label, readSDFG(field(o, "sdfg")),
              stringSet(o.get("in_connectors")),
              stringSet(o.get("out_connectors")),
              stringMap(o.get("symbol_mapping")));
    } else {
      throw new SerializationException("Unknown node type: " + type);
    }
    readConnectors(n, o);
    return n;
  }

  private static void readConnectors(Node n, JsonNode o) {
    for (String c: stringSet(o.get("in_connectors"))) {
      n.addInConnector(c);
    }
    for (String c: stringSet(o.get("out_connectors"))) {
      n.addOutConnector(c);
    }
  }

  private Memlet readMemlet(JsonNode o) {
    String data = optText(o, "data");
    if (data == null) {
      return Memlet.empty();
    }
    String subset = optText(o, "subset");
    Memlet m = new Memlet(data, subset == null ? null :
                                Subset.fromString(subset));
    String other = optText(o, "other_subset");
    if (other != null) {
      m.setOtherSubset(Subset.fromString(other));
    }
    m.setWcr(optText(o, "wcr"));
    m.setDynamic(o.has("dynamic") && o.get("dynamic").asBoolean());
    return m;
  }

  /**
   * The stored scope table is redundant; report if it disagrees with the
   * one computed from the loaded graph
   */
  private void checkScopeDict(SDFGState state, JsonNode stored) {
    if (stored == null || stored.isNull()) {
      return;
    }
    ListMultimap<Integer, Integer> expected = ArrayListMultimap.create();
    Iterator<Map.Entry<String, JsonNode>> it = stored.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      for (JsonNode child: e.getValue()) {
        expected.put(Integer.valueOf(e.getKey()), child.asInt());
      }
    }
    ListMultimap<Integer, Integer> actual = ArrayListMultimap.create();
    for (Map.Entry<EntryNode, List<Node>> e:
                                  state.scopeChildren().entrySet()) {
      int key = e.getKey() == null ? TOP_LEVEL : state.nodeId(e.getKey());
      for (Node n: e.getValue()) {
        actual.put(key, state.nodeId(n));
      }
    }
    if (!expected.equals(actual)) {
      Logging.uniqueWarn("Stored scope_dict of state " + state.getLabel() +
                         " does not match its structure; using the computed one");
    }
  }
}
