package com.jsrefactor.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.ResolvableDeserializer;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.jsrefactor.ast.*;
import com.jsrefactor.jackson.mixins.NodeMixin;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module binding the AST records to ESTree JSON.
 *
 * This module handles:
 * - Polymorphic node types through the {@code type} property (see {@link NodeMixin})
 * - A {@code loc} object in place of the startLine/startCol/endLine/endCol components
 * - Null fields that ESTree always writes
 * - JavaScript-compatible literal numbers
 */
public class AstModule extends SimpleModule {

    private static final Set<String> EXCLUDED_FIELDS = Set.of("startLine", "startCol", "endLine", "endCol");

    private static final List<Class<? extends Node>> NODE_TYPES = List.of(
        Program.class,
        ExpressionStatement.class,
        BlockStatement.class,
        IfStatement.class,
        SwitchStatement.class,
        SwitchCase.class,
        ReturnStatement.class,
        BreakStatement.class,
        ThrowStatement.class,
        EmptyStatement.class,
        VariableDeclaration.class,
        VariableDeclarator.class,
        FunctionDeclaration.class,
        Identifier.class,
        Literal.class,
        ThisExpression.class,
        TemplateLiteral.class,
        TemplateElement.class,
        ObjectExpression.class,
        ObjectPattern.class,
        Property.class,
        ArrayExpression.class,
        MemberExpression.class,
        CallExpression.class,
        BinaryExpression.class,
        LogicalExpression.class,
        UnaryExpression.class,
        ConditionalExpression.class,
        AssignmentExpression.class,
        ArrowFunctionExpression.class
    );

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.jsrefactor", "sleight-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Pattern.class, NodeMixin.class);

        // Type ids are the ESTree names, which match the record names
        for (Class<? extends Node> type : NODE_TYPES) {
            context.registerSubtypes(new NamedType(type, type.getSimpleName()));
        }

        context.setMixInAnnotations(Literal.class, LiteralMixin.class);
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ReturnStatementMixin.class);
        context.setMixInAnnotations(SwitchCase.class, SwitchCaseMixin.class);
        context.setMixInAnnotations(VariableDeclarator.class, VariableDeclaratorMixin.class);
        context.setMixInAnnotations(TemplateElement.TemplateElementValue.class, TemplateElementValueMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
        context.addBeanDeserializerModifier(new AstDeserializerModifier());
    }

    // ==================== Serialization Mixins ====================

    private abstract static class LiteralMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    private abstract static class IfStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }

    private abstract static class ReturnStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression argument();
    }

    private abstract static class SwitchCaseMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();
    }

    private abstract static class VariableDeclaratorMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    private abstract static class TemplateElementValueMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract String cooked();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            List<BeanPropertyWriter> filtered = new ArrayList<>();
            boolean hasLoc = false;
            for (BeanPropertyWriter prop : beanProperties) {
                if (EXCLUDED_FIELDS.contains(prop.getName())) {
                    continue;
                }
                if ("loc".equals(prop.getName())) {
                    hasLoc = true;
                }
                filtered.add(prop);
            }

            // Default interface methods are not always picked up through the mixin
            if (!hasLoc) {
                filtered.add(new LocBeanPropertyWriter());
            }
            return filtered;
        }
    }

    private static class LocBeanPropertyWriter extends BeanPropertyWriter {

        LocBeanPropertyWriter() {
            super();
        }

        @Override
        public String getName() {
            return "loc";
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            gen.writeFieldName("loc");
            prov.defaultSerializeValue(((Node) bean).loc(), gen);
        }
    }

    // ==================== Deserializer Modifier ====================

    private static class AstDeserializerModifier extends BeanDeserializerModifier {
        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config,
                                                      BeanDescription beanDesc,
                                                      JsonDeserializer<?> deserializer) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (Node.class.isAssignableFrom(beanClass) && beanClass.isRecord()) {
                return new AstNodeDeserializer(deserializer, beanClass);
            }
            return deserializer;
        }
    }

    /**
     * Flattens the ESTree {@code loc} object of one node into the record's
     * position components before the bean deserializer sees it. Child nodes
     * go through their own instance of this deserializer.
     */
    private static class AstNodeDeserializer extends JsonDeserializer<Object>
        implements ResolvableDeserializer, ContextualDeserializer {

        private final JsonDeserializer<?> delegate;
        private final Class<?> beanClass;

        AstNodeDeserializer(JsonDeserializer<?> delegate, Class<?> beanClass) {
            this.delegate = delegate;
            this.beanClass = beanClass;
        }

        @Override
        public void resolve(DeserializationContext ctxt) throws JsonMappingException {
            if (delegate instanceof ResolvableDeserializer resolvable) {
                resolvable.resolve(ctxt);
            }
        }

        @Override
        public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property)
            throws JsonMappingException {
            if (delegate instanceof ContextualDeserializer contextual) {
                JsonDeserializer<?> contextualized = contextual.createContextual(ctxt, property);
                if (contextualized != delegate) {
                    return new AstNodeDeserializer(contextualized, beanClass);
                }
            }
            return this;
        }

        @Override
        public Class<?> handledType() {
            return beanClass;
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (node instanceof ObjectNode objNode) {
                flattenLocation(objNode);
            }

            JsonParser jp = node.traverse(p.getCodec());
            jp.nextToken();
            Object result = delegate.deserialize(jp, ctxt);
            return normalizeLiteral(result);
        }

        private static void flattenLocation(ObjectNode objNode) {
            JsonNode loc = objNode.remove("loc");
            if (loc == null || !loc.isObject()) {
                return;
            }
            JsonNode start = loc.path("start");
            JsonNode end = loc.path("end");
            objNode.put("startLine", start.path("line").asInt(0));
            objNode.put("startCol", start.path("column").asInt(0));
            objNode.put("endLine", end.path("line").asInt(0));
            objNode.put("endCol", end.path("column").asInt(0));
        }

        // JSON integers come back as Integer or Long; the parser always produces Double
        private static Object normalizeLiteral(Object result) {
            if (result instanceof Literal literal
                && literal.value() instanceof Number number
                && !(number instanceof Double)) {
                return new Literal(literal.start(), literal.end(), literal.startLine(), literal.startCol(),
                    literal.endLine(), literal.endCol(), number.doubleValue(), literal.raw());
            }
            return result;
        }
    }
}
