package com.jsrefactor.json;

import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Program;

/**
 * Reads ESTree JSON into AST records.
 *
 * <p>Only the node types the refactorings understand are accepted; an unknown
 * {@code type} is an error. Missing positions default to zero.</p>
 */
public interface AstJsonDeserializer {

    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * @param json the JSON text of a single node
     * @param type the expected node type
     * @throws AstJsonException if the text is not valid JSON or does not describe a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
