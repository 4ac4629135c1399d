package com.warden.sandbox;

import com.warden.core.model.ExecutionResult;
import com.warden.core.model.IsolationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bottom of the degradation ladder: content was approved by static analysis but is never run.
 */
public class AstOnlySandboxBackend implements SandboxBackend {

    private static final Logger log = LoggerFactory.getLogger(AstOnlySandboxBackend.class);

    @Override
    public IsolationLevel level() {
        return IsolationLevel.NONE_AST_ONLY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public SandboxInstance create() {
        return new SandboxInstance(IsolationLevel.NONE_AST_ONLY, "ast-only");
    }

    @Override
    public ExecutionResult execute(SandboxInstance instance, ExecutionRequest request) {
        log.info("Request {} approved at NONE_AST_ONLY; content not executed", request.requestId());
        return ExecutionResult.notExecuted(IsolationLevel.NONE_AST_ONLY);
    }

    @Override
    public boolean reset(SandboxInstance instance) {
        return true;
    }

    @Override
    public void kill(SandboxInstance instance) {
        // nothing runs
    }

    @Override
    public void destroy(SandboxInstance instance) {
        // nothing to release
    }
}
