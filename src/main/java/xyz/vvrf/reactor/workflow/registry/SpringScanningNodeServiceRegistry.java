package xyz.vvrf.reactor.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.reactor.workflow.annotation.NodeServiceType;
import xyz.vvrf.reactor.workflow.core.NodeService;
import xyz.vvrf.reactor.workflow.core.NodeType;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一个 {@link NodeServiceRegistry} 实现，它会自动发现并注册
 * 使用 {@link NodeServiceType} 注解的 Spring Bean，并在初始化完成后校验全部类型都已注册。
 */
@Slf4j
public class SpringScanningNodeServiceRegistry implements NodeServiceRegistry, ApplicationContextAware, InitializingBean {

    private ApplicationContext applicationContext;
    private final SimpleNodeServiceRegistry delegateRegistry = new SimpleNodeServiceRegistry();

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningNodeServiceRegistry 中 ApplicationContext 未设置");
        }
        log.info("开始扫描 @NodeServiceType Bean...");
        scanAndRegisterServices();
        delegateRegistry.verifyComplete();
    }

    private void scanAndRegisterServices() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(NodeServiceType.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object beanInstance = entry.getValue();
            NodeServiceType annotation = applicationContext.findAnnotationOnBean(beanName, NodeServiceType.class);

            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @NodeServiceType 注解，尽管 getBeansWithAnnotation 返回了它。", beanName);
                continue;
            }
            if (!(beanInstance instanceof NodeService)) {
                log.error("Bean '{}' 使用了 @NodeServiceType 注解，但未实现 NodeService 接口。跳过注册。", beanName);
                continue;
            }
            NodeService service = (NodeService) beanInstance;
            if (service.nodeType() != annotation.value()) {
                throw new BeanCreationException(beanName, String.format(
                        "@NodeServiceType(%s) 与 nodeType() 返回的 '%s' 不一致", annotation.value(), service.nodeType()));
            }
            try {
                delegateRegistry.register(service);
                registeredCount++;
            } catch (IllegalArgumentException e) {
                log.error("注册节点实现 Bean '{}' (类型: '{}') 失败: {}", beanName, annotation.value(), e.getMessage());
            }
        }
        log.info("扫描完成。共注册了 {} 个节点实现。", registeredCount);
    }

    @Override
    public void register(NodeService service) {
        log.warn("尝试在 SpringScanningNodeServiceRegistry 上手动注册类型 '{}'。推荐使用自动扫描。", service.nodeType());
        delegateRegistry.register(service);
    }

    @Override
    public Optional<NodeService> getService(NodeType nodeType) {
        return delegateRegistry.getService(nodeType);
    }

    @Override
    public NodeService requireService(NodeType nodeType) {
        return delegateRegistry.requireService(nodeType);
    }

    @Override
    public Set<NodeType> getRegisteredTypes() {
        return delegateRegistry.getRegisteredTypes();
    }

    @Override
    public void verifyComplete() {
        delegateRegistry.verifyComplete();
    }
}
