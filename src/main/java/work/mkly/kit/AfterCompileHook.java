package work.mkly.kit;

import work.mkly.api.CompileResult;
import work.mkly.runtime.CompileContext;

/**
 * Post-processes a finished compile result.
 */
@FunctionalInterface
public interface AfterCompileHook {
    CompileResult apply(CompileResult result, CompileContext context);
}
