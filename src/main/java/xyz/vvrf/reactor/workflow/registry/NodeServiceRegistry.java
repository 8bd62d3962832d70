package xyz.vvrf.reactor.workflow.registry;

import xyz.vvrf.reactor.workflow.core.NodeService;
import xyz.vvrf.reactor.workflow.core.NodeType;

import java.util.Optional;
import java.util.Set;

/**
 * 节点类型到 {@link NodeService} 实现的映射。
 */
public interface NodeServiceRegistry {

    /**
     * 注册一个实现，同一类型只能注册一次。
     *
     * @throws IllegalArgumentException 类型已注册
     */
    void register(NodeService service);

    Optional<NodeService> getService(NodeType nodeType);

    /**
     * 获取实现，缺失时视为致命配置错误。
     *
     * @throws xyz.vvrf.reactor.workflow.exception.NodeServiceNotFoundException 类型未注册
     */
    NodeService requireService(NodeType nodeType);

    Set<NodeType> getRegisteredTypes();

    /**
     * 校验所有节点类型都有实现。
     *
     * @throws IllegalStateException 存在未注册的类型
     */
    void verifyComplete();
}
