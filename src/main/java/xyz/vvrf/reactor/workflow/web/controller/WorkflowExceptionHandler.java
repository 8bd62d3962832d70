package xyz.vvrf.reactor.workflow.web.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import xyz.vvrf.reactor.workflow.exception.ExpressionSyntaxException;
import xyz.vvrf.reactor.workflow.exception.NodeServiceNotFoundException;
import xyz.vvrf.reactor.workflow.exception.NodeValidationException;
import xyz.vvrf.reactor.workflow.exception.RunNotFoundException;
import xyz.vvrf.reactor.workflow.exception.WorkflowNotFoundException;
import xyz.vvrf.reactor.workflow.web.dto.ErrorResponse;

/**
 * 把工作流异常映射为 HTTP 状态码：配置和语法问题 400，找不到工作流或运行 404，
 * 对未通过校验的图做规划 409。
 */
@Slf4j
@RestControllerAdvice(assignableTypes = WorkflowController.class)
public class WorkflowExceptionHandler {

    @ExceptionHandler(NodeValidationException.class)
    public ResponseEntity<ErrorResponse> handleNodeValidation(NodeValidationException e) {
        log.debug("节点配置校验失败: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("node_validation_failed")
                .message(e.getMessage())
                .fieldPath(e.getFieldPath())
                .build());
    }

    @ExceptionHandler(ExpressionSyntaxException.class)
    public ResponseEntity<ErrorResponse> handleExpressionSyntax(ExpressionSyntaxException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("expression_syntax_error")
                .message(e.getMessage())
                .fieldPath(e.getPath())
                .build());
    }

    @ExceptionHandler({IllegalArgumentException.class, NodeServiceNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("bad_request")
                .message(e.getMessage())
                .build());
    }

    @ExceptionHandler({WorkflowNotFoundException.class, RunNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                .error("not_found")
                .message(e.getMessage())
                .build());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidGraph(IllegalStateException e) {
        log.warn("请求的操作需要合法的工作流图: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.builder()
                .error("invalid_graph")
                .message(e.getMessage())
                .build());
    }
}
