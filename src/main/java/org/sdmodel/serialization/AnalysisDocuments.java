package org.sdmodel.serialization;

import org.sdmodel.graph.Loop;
import org.sdmodel.graph.LoopSearchResult;
import org.sdmodel.graph.LoopSummary;
import org.sdmodel.graph.SignedEdge;
import org.sdmodel.mdl.SketchRecord.CloudRecord;
import org.sdmodel.mdl.SketchRecord.ValveRecord;
import org.sdmodel.topology.Connection;
import org.sdmodel.topology.MaterialFlow;
import org.sdmodel.topology.TypedModel;
import org.sdmodel.topology.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the JSON documents handed to downstream collaborators:
 *
 * <pre>
 * {"connections":[{"from":"A","to":"B","relationship":"positive"}, ...]}
 *
 * {"valves":[{"id":5,"name":"Births"}],"clouds":[{"id":2}],
 *  "flows":[{"valve_id":5,"name":"Births","from":{"kind":"cloud","ref":2},"to":{"kind":"stock","ref":"Population"}}]}
 *
 * {"total_loops":1,
 *  "loops":[{"nodes":[...],"edges":[{"from","to","relationship"}],"negative_edges":1,"type":"B","length":3}],
 *  "summary":{"reinforcing_loops":0,"balancing_loops":1,"shortest_loop":3,"longest_loop":3}}
 * </pre>
 */
public final class AnalysisDocuments {

    private AnalysisDocuments() {
    }

    // ── Connections ──

    public static Map<String, Object> connections(List<Connection> connections) {
        List<Object> items = new ArrayList<>();
        for (Connection c : connections) {
            items.add(edge(c.fromVariable(), c.toVariable(), c.polarity().relationship()));
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("connections", items);
        return doc;
    }

    public static String connectionsJson(TypedModel model) {
        return ModelJson.writePretty(connections(model.connections()));
    }

    // ── Variables ──

    public static Map<String, Object> variables(TypedModel model) {
        List<Object> items = new ArrayList<>();
        for (Variable v : model.variables()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", v.id());
            item.put("name", v.name());
            item.put("type", v.kind().label());
            item.put("x", v.position().x());
            item.put("y", v.position().y());
            item.put("width", v.size().width());
            item.put("height", v.size().height());
            items.add(item);
        }
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("variables", items);
        return doc;
    }

    // ── Plumbing ──

    public static Map<String, Object> plumbing(TypedModel model) {
        Map<Integer, String> valveNames = new LinkedHashMap<>();
        for (MaterialFlow flow : model.flows()) {
            valveNames.put(flow.valveId(), flow.name());
        }

        List<Object> valves = new ArrayList<>();
        for (ValveRecord valve : model.model().sketch().valves()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", valve.id());
            item.put("name", valveNames.get(valve.id()));
            valves.add(item);
        }
        List<Object> clouds = new ArrayList<>();
        for (CloudRecord cloud : model.model().sketch().clouds()) {
            if (cloud.isCloud()) {
                clouds.add(Map.of("id", cloud.id()));
            }
        }
        List<Object> flows = new ArrayList<>();
        for (MaterialFlow flow : model.flows()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("valve_id", flow.valveId());
            item.put("name", flow.name());
            item.put("from", endpoint(flow.from()));
            item.put("to", endpoint(flow.to()));
            flows.add(item);
        }

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("valves", valves);
        doc.put("clouds", clouds);
        doc.put("flows", flows);
        return doc;
    }

    public static String plumbingJson(TypedModel model) {
        return ModelJson.writePretty(plumbing(model));
    }

    private static Map<String, Object> endpoint(MaterialFlow.Endpoint end) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("kind", end.kind().label());
        item.put("ref", end.name() != null ? end.name() : end.id());
        return item;
    }

    // ── Loops ──

    public static Map<String, Object> loops(LoopSearchResult result) {
        List<Object> items = new ArrayList<>();
        for (Loop loop : result.loops()) {
            List<Object> edges = new ArrayList<>();
            for (SignedEdge e : loop.edges()) {
                edges.add(edge(e.from(), e.to(), e.polarity().relationship()));
            }
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("nodes", new ArrayList<Object>(loop.nodes()));
            item.put("edges", edges);
            item.put("negative_edges", loop.negativeEdgeCount());
            item.put("type", loop.type().code());
            item.put("length", loop.length());
            items.add(item);
        }

        LoopSummary s = result.summary();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("reinforcing_loops", s.reinforcingLoops());
        summary.put("balancing_loops", s.balancingLoops());
        summary.put("shortest_loop", s.shortestLoop());
        summary.put("longest_loop", s.longestLoop());
        if (result.isTruncated()) {
            summary.put("truncated", true);
            summary.put("stopped_by", result.stoppedBy().name());
        }

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("total_loops", result.totalLoops());
        doc.put("loops", items);
        doc.put("summary", summary);
        return doc;
    }

    public static String loopsJson(LoopSearchResult result) {
        return ModelJson.writePretty(loops(result));
    }

    private static Map<String, Object> edge(String from, String to, String relationship) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("from", from);
        item.put("to", to);
        item.put("relationship", relationship);
        return item;
    }
}
