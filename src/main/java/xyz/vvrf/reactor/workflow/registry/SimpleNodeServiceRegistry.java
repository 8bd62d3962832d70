package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.workflow.core.NodeService;
import xyz.vvrf.reactor.workflow.core.NodeType;
import xyz.vvrf.reactor.workflow.exception.NodeServiceNotFoundException;

import java.util.*;

/**
 * 基于 {@link EnumMap} 的 {@link NodeServiceRegistry} 实现。
 * 注册在启动阶段完成，之后只读，因此读操作不加锁。
 */
@Slf4j
public class SimpleNodeServiceRegistry implements NodeServiceRegistry {

    private final Map<NodeType, NodeService> services = new EnumMap<>(NodeType.class);

    public SimpleNodeServiceRegistry() {
    }

    public SimpleNodeServiceRegistry(Collection<? extends NodeService> initialServices) {
        initialServices.forEach(this::register);
    }

    @Override
    public synchronized void register(NodeService service) {
        Objects.requireNonNull(service, "节点实现不能为空");
        NodeType nodeType = Objects.requireNonNull(service.nodeType(), "节点实现的类型不能为空");
        if (services.containsKey(nodeType)) {
            throw new IllegalArgumentException(String.format("节点类型 '%s' 已注册 (现有实现: %s, 新实现: %s)",
                    nodeType, services.get(nodeType).getClass().getSimpleName(), service.getClass().getSimpleName()));
        }
        services.put(nodeType, service);
        log.debug("注册节点实现: 类型='{}', 实现='{}'", nodeType, service.getClass().getSimpleName());
    }

    @Override
    public Optional<NodeService> getService(NodeType nodeType) {
        return Optional.ofNullable(services.get(nodeType));
    }

    @Override
    public NodeService requireService(NodeType nodeType) {
        NodeService service = services.get(nodeType);
        if (service == null) {
            throw new NodeServiceNotFoundException(nodeType);
        }
        return service;
    }

    @Override
    public Set<NodeType> getRegisteredTypes() {
        EnumSet<NodeType> registered = EnumSet.noneOf(NodeType.class);
        registered.addAll(services.keySet());
        return Collections.unmodifiableSet(registered);
    }

    @Override
    public void verifyComplete() {
        EnumSet<NodeType> missing = EnumSet.allOf(NodeType.class);
        missing.removeAll(services.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("以下节点类型没有注册实现: " + missing);
        }
        log.info("节点注册表校验通过，已注册全部 {} 个节点类型。", services.size());
    }
}
