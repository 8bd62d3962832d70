package xyz.vvrf.reactor.workflow.core;

import java.util.*;

/**
 * 由节点和边计算出的只读邻接视图，每次校验/规划/执行时重新构建。
 * <p>
 * 构建时不做任何拒绝：引用不存在节点的边和重复的 (parent, child) 边对被记录下来
 * 但不进入邻接表（交由校验器报告），自环保留在邻接表中以便环检测能发现它。
 * 入边与出边保持边的声明顺序。
 */
public final class WorkflowGraph {

    private final Map<Long, WorkflowNode> nodes;
    private final List<WorkflowEdge> edges;
    private final Map<Long, List<WorkflowEdge>> incoming;
    private final Map<Long, List<WorkflowEdge>> outgoing;
    private final List<WorkflowEdge> danglingEdges;
    private final List<WorkflowEdge> duplicateEdges;

    private WorkflowGraph(Collection<WorkflowNode> nodeList, Collection<WorkflowEdge> edgeList) {
        Map<Long, WorkflowNode> byId = new TreeMap<>();
        for (WorkflowNode node : nodeList) {
            byId.put(node.getId(), node);
        }
        this.nodes = Collections.unmodifiableMap(byId);
        this.edges = Collections.unmodifiableList(new ArrayList<>(edgeList));

        Map<Long, List<WorkflowEdge>> in = new HashMap<>();
        Map<Long, List<WorkflowEdge>> out = new HashMap<>();
        for (Long id : byId.keySet()) {
            in.put(id, new ArrayList<>());
            out.put(id, new ArrayList<>());
        }
        List<WorkflowEdge> dangling = new ArrayList<>();
        List<WorkflowEdge> duplicates = new ArrayList<>();
        Set<String> seenPairs = new HashSet<>();
        for (WorkflowEdge edge : edgeList) {
            if (!byId.containsKey(edge.getParentId()) || !byId.containsKey(edge.getChildId())) {
                dangling.add(edge);
                continue;
            }
            if (!seenPairs.add(edge.getParentId() + "->" + edge.getChildId())) {
                duplicates.add(edge);
                continue;
            }
            out.get(edge.getParentId()).add(edge);
            in.get(edge.getChildId()).add(edge);
        }
        this.incoming = in;
        this.outgoing = out;
        this.danglingEdges = Collections.unmodifiableList(dangling);
        this.duplicateEdges = Collections.unmodifiableList(duplicates);
    }

    public static WorkflowGraph of(Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges) {
        return new WorkflowGraph(
                Objects.requireNonNull(nodes, "节点列表不能为空"),
                edges == null ? Collections.emptyList() : edges);
    }

    /**
     * 按 id 升序排列的全部节点。
     */
    public Collection<WorkflowNode> getNodes() {
        return nodes.values();
    }

    public Set<Long> getNodeIds() {
        return nodes.keySet();
    }

    public List<WorkflowEdge> getEdges() {
        return edges;
    }

    public boolean contains(long nodeId) {
        return nodes.containsKey(nodeId);
    }

    public WorkflowNode getNode(long nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("图中不存在节点: " + nodeId);
        }
        return node;
    }

    public Optional<WorkflowNode> findNode(long nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public List<WorkflowEdge> getIncomingEdges(long nodeId) {
        return Collections.unmodifiableList(incoming.getOrDefault(nodeId, Collections.emptyList()));
    }

    public List<WorkflowEdge> getOutgoingEdges(long nodeId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(nodeId, Collections.emptyList()));
    }

    /**
     * 父节点 id，按入边声明顺序。
     */
    public List<Long> getParents(long nodeId) {
        List<Long> parents = new ArrayList<>();
        for (WorkflowEdge edge : getIncomingEdges(nodeId)) {
            parents.add(edge.getParentId());
        }
        return parents;
    }

    public List<Long> getChildren(long nodeId) {
        List<Long> children = new ArrayList<>();
        for (WorkflowEdge edge : getOutgoingEdges(nodeId)) {
            children.add(edge.getChildId());
        }
        return children;
    }

    public int inDegree(long nodeId) {
        return getIncomingEdges(nodeId).size();
    }

    public int outDegree(long nodeId) {
        return getOutgoingEdges(nodeId).size();
    }

    /**
     * 沿边反向可达的全部节点（不含自身，除非存在环）。
     */
    public Set<Long> getAncestors(long nodeId) {
        return walk(nodeId, incoming, true);
    }

    /**
     * 沿边正向可达的全部节点（不含自身，除非存在环）。
     */
    public Set<Long> getDescendants(long nodeId) {
        return walk(nodeId, outgoing, false);
    }

    private Set<Long> walk(long start, Map<Long, List<WorkflowEdge>> adjacency, boolean reverse) {
        Set<Long> visited = new LinkedHashSet<>();
        Deque<Long> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            long current = stack.pop();
            for (WorkflowEdge edge : adjacency.getOrDefault(current, Collections.emptyList())) {
                long next = reverse ? edge.getParentId() : edge.getChildId();
                if (visited.add(next)) {
                    stack.push(next);
                }
            }
        }
        return visited;
    }

    /**
     * 引用了不存在节点的边。
     */
    public List<WorkflowEdge> getDanglingEdges() {
        return danglingEdges;
    }

    /**
     * 与前面某条边 (parent, child) 相同的重复边。
     */
    public List<WorkflowEdge> getDuplicateEdges() {
        return duplicateEdges;
    }

    @Override
    public String toString() {
        return "WorkflowGraph{nodes=" + nodes.keySet() + ", edges=" + edges.size() + '}';
    }
}
