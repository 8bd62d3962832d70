package xyz.vvrf.reactor.workflow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.WorkflowEdge;
import xyz.vvrf.reactor.workflow.core.WorkflowGraph;

import java.util.*;

/**
 * 工作流图的拓扑排序与环检测。
 * 这里的方法都不抛出结构错误，结果交由调用方（校验器）转成错误信息。
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * Kahn 算法的结果：已排序的节点，以及因环无法排序的剩余节点。
     */
    public static final class TopologicalSort {
        private final List<Long> order;
        private final List<Long> remaining;

        TopologicalSort(List<Long> order, List<Long> remaining) {
            this.order = Collections.unmodifiableList(order);
            this.remaining = Collections.unmodifiableList(remaining);
        }

        public List<Long> getOrder() {
            return order;
        }

        /**
         * 位于环上或在环下游的节点，按 id 升序。
         */
        public List<Long> getRemaining() {
            return remaining;
        }

        public boolean isComplete() {
            return remaining.isEmpty();
        }
    }

    /**
     * 使用 Kahn 算法计算拓扑排序。同一步有多个入度为 0 的候选时取 id 最小者，
     * 保证相同的图总是得到相同的顺序。
     */
    public static TopologicalSort topologicalSort(WorkflowGraph graph) {
        Map<Long, Integer> inDegree = new HashMap<>();
        for (Long nodeId : graph.getNodeIds()) {
            inDegree.put(nodeId, graph.inDegree(nodeId));
        }

        PriorityQueue<Long> queue = new PriorityQueue<>();
        for (Map.Entry<Long, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.offer(entry.getKey());
            }
        }

        List<Long> sortedOrder = new ArrayList<>();
        while (!queue.isEmpty()) {
            long u = queue.poll();
            sortedOrder.add(u);
            for (WorkflowEdge edge : graph.getOutgoingEdges(u)) {
                long v = edge.getChildId();
                int remainingDegree = inDegree.get(v) - 1;
                inDegree.put(v, remainingDegree);
                if (remainingDegree == 0) {
                    queue.offer(v);
                }
            }
        }

        List<Long> remaining = new ArrayList<>();
        if (sortedOrder.size() != graph.getNodeIds().size()) {
            Set<Long> sorted = new HashSet<>(sortedOrder);
            for (Long nodeId : graph.getNodeIds()) {
                if (!sorted.contains(nodeId)) {
                    remaining.add(nodeId);
                }
            }
            log.debug("Topological sort incomplete, unsorted nodes: {}", remaining);
        }
        return new TopologicalSort(sortedOrder, remaining);
    }

    /**
     * 在 Kahn 算法剩余的节点中用 DFS 找出一个代表性的环，返回首尾相同的路径（如 [1, 2, 1]）。
     * 从 id 最小的剩余节点开始，按出边声明顺序遍历。
     */
    public static List<Long> findCyclePath(WorkflowGraph graph, List<Long> remaining) {
        if (remaining.isEmpty()) {
            return Collections.emptyList();
        }
        Set<Long> candidates = new HashSet<>(remaining);
        Set<Long> visited = new HashSet<>();
        Set<Long> visiting = new HashSet<>();
        Deque<Long> path = new ArrayDeque<>();

        for (Long start : remaining) {
            if (!visited.contains(start)) {
                List<Long> cycle = cycleDFS(start, graph, candidates, visited, visiting, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        return new ArrayList<>(remaining.subList(0, Math.min(3, remaining.size())));
    }

    private static List<Long> cycleDFS(long nodeId, WorkflowGraph graph, Set<Long> candidates,
                                       Set<Long> visited, Set<Long> visiting, Deque<Long> path) {
        visited.add(nodeId);
        visiting.add(nodeId);
        path.addLast(nodeId);

        for (WorkflowEdge edge : graph.getOutgoingEdges(nodeId)) {
            long neighbor = edge.getChildId();
            if (!candidates.contains(neighbor)) {
                continue;
            }
            if (visiting.contains(neighbor)) {
                List<Long> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (Long onPath : path) {
                    if (onPath == neighbor) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(onPath);
                    }
                }
                cycle.add(neighbor);
                return cycle;
            }
            if (!visited.contains(neighbor)) {
                List<Long> cycle = cycleDFS(neighbor, graph, candidates, visited, visiting, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        visiting.remove(nodeId);
        path.removeLast();
        return null;
    }
}
