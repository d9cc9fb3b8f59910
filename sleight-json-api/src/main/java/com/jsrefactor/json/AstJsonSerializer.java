package com.jsrefactor.json;

import com.jsrefactor.ast.Node;

/**
 * Writes AST nodes as ESTree JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and its subtree. Locations are written as an ESTree
     * {@code loc} object; nodes built by a refactoring carry a zero location.
     *
     * @param node the node to serialize
     * @return the compact JSON text
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;
}
