package com.jsrefactor.json;

import com.jsrefactor.config.RefactoringConfig;

/**
 * Reads {@link RefactoringConfig} from a JSON object such as
 * <pre>{@code {"indentSize": 4, "equalityOperators": ["===", "=="]}}</pre>
 *
 * Keys that are absent keep their value from {@link RefactoringConfig#defaults()}.
 * Unknown keys are ignored.
 */
public interface RefactoringConfigReader {

    /**
     * @throws AstJsonException if the text is not a JSON object or a value is rejected by the configuration
     */
    RefactoringConfig read(String json) throws AstJsonException;

    String write(RefactoringConfig config) throws AstJsonException;
}
