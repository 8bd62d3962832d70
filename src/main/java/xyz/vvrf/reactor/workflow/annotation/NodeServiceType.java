package xyz.vvrf.reactor.workflow.annotation;

import org.springframework.stereotype.Component;
import xyz.vvrf.reactor.workflow.core.NodeType;

import java.lang.annotation.*;

/**
 * 标记一个类为某个节点类型的 {@link xyz.vvrf.reactor.workflow.core.NodeService} 实现。
 * 被 {@link xyz.vvrf.reactor.workflow.registry.SpringScanningNodeServiceRegistry} 自动发现并注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface NodeServiceType {

    /**
     * 该实现负责的节点类型，必须与 {@code nodeType()} 的返回值一致。
     */
    NodeType value();
}
