package com.jsrefactor.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.jsrefactor.ast.SourceLocation;

/**
 * Polymorphic handling for the node hierarchy: the ESTree {@code type} field
 * carries the record's simple name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class NodeMixin {

    @JsonProperty("loc")
    abstract SourceLocation loc();

    @JsonIgnore
    abstract boolean hasLocation();
}
