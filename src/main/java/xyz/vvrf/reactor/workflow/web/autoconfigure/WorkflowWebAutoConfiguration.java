package xyz.vvrf.reactor.workflow.web.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.vvrf.reactor.workflow.service.WorkflowOperations;
import xyz.vvrf.reactor.workflow.spring.boot.WorkflowFrameworkAutoConfiguration;
import xyz.vvrf.reactor.workflow.web.controller.WorkflowController;
import xyz.vvrf.reactor.workflow.web.controller.WorkflowExceptionHandler;

@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@AutoConfigureAfter(WorkflowFrameworkAutoConfiguration.class)
@ConditionalOnBean(WorkflowOperations.class)
public class WorkflowWebAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WorkflowController workflowController(WorkflowOperations operations, ObjectMapper objectMapper) {
        return new WorkflowController(operations, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowExceptionHandler workflowExceptionHandler() {
        return new WorkflowExceptionHandler();
    }
}
