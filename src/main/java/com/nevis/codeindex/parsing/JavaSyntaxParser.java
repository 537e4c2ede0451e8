package com.nevis.codeindex.parsing;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.nevis.codeindex.exception.SourceParseException;

import java.util.Optional;
import java.util.stream.Collectors;

public class JavaSyntaxParser implements SyntaxParser {

    public static final String LANGUAGE = "java";

    static final String PROGRAM = "program";
    static final String CLASS = "class_declaration";
    static final String INTERFACE = "interface_declaration";
    static final String ENUM = "enum_declaration";
    static final String RECORD = "record_declaration";
    static final String METHOD = "method_declaration";
    static final String CONSTRUCTOR = "constructor_declaration";
    static final String CONSTANT = "constant_declaration";
    static final String ANNOTATION = "annotation";
    static final String SUPERCLASS = "superclass";
    static final String SUPER_INTERFACES = "super_interfaces";
    static final String JAVADOC = "javadoc";
    static final String METHOD_INVOCATION = "method_invocation";

    @Override
    public SyntaxTree parse(String filePath, String source) {
        // JavaParser instances are not thread-safe
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .limit(3)
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new SourceParseException(filePath, problems.isEmpty() ? "unparseable compilation unit" : problems);
        }
        LineIndex index = new LineIndex(source);
        SyntaxNode program = new SyntaxNode(PROGRAM, null, 0, source.length(), 1, index.lineCount());
        Converter converter = new Converter(index);
        result.getResult().get().getTypes().forEach(type -> converter.addType(program, type));
        return new SyntaxTree(LANGUAGE, source, program);
    }

    private static final class Converter {

        private final LineIndex index;

        Converter(LineIndex index) {
            this.index = index;
        }

        void addType(SyntaxNode parent, TypeDeclaration<?> type) {
            String nodeType = typeNodeType(type);
            if (nodeType == null) {
                return;
            }
            Optional<SyntaxNode> created = node(nodeType, type.getNameAsString(), type);
            if (created.isEmpty()) {
                return;
            }
            SyntaxNode node = parent.addChild(created.get());
            addAnnotations(node, type.getAnnotations());
            addJavadoc(node, type);
            if (type instanceof ClassOrInterfaceDeclaration declaration) {
                addBaseTypes(node, declaration.isInterface() ? SUPER_INTERFACES : SUPERCLASS, declaration.getExtendedTypes());
                addBaseTypes(node, SUPER_INTERFACES, declaration.getImplementedTypes());
            } else if (type instanceof EnumDeclaration declaration) {
                addBaseTypes(node, SUPER_INTERFACES, declaration.getImplementedTypes());
            } else if (type instanceof RecordDeclaration declaration) {
                addBaseTypes(node, SUPER_INTERFACES, declaration.getImplementedTypes());
            }
            boolean isInterface = INTERFACE.equals(nodeType);
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof CallableDeclaration<?> callable) {
                    addCallable(node, callable);
                } else if (member instanceof FieldDeclaration field
                        && (isInterface || (field.isStatic() && field.isFinal()))) {
                    addConstants(node, field);
                } else if (member instanceof TypeDeclaration<?> nested) {
                    addType(node, nested);
                }
            }
        }

        private void addCallable(SyntaxNode parent, CallableDeclaration<?> callable) {
            String nodeType = callable instanceof ConstructorDeclaration ? CONSTRUCTOR : METHOD;
            node(nodeType, callable.getNameAsString(), callable).ifPresent(created -> {
                SyntaxNode node = parent.addChild(created);
                addAnnotations(node, callable.getAnnotations());
                addJavadoc(node, callable);
                for (MethodCallExpr call : callable.findAll(MethodCallExpr.class)) {
                    node(METHOD_INVOCATION, call.getNameAsString(), call).ifPresent(node::addChild);
                }
            });
        }

        private void addConstants(SyntaxNode parent, FieldDeclaration field) {
            for (VariableDeclarator variable : field.getVariables()) {
                node(CONSTANT, variable.getNameAsString(), field).ifPresent(created -> {
                    SyntaxNode node = parent.addChild(created);
                    addAnnotations(node, field.getAnnotations());
                    addJavadoc(node, field);
                });
            }
        }

        private void addAnnotations(SyntaxNode parent, NodeList<AnnotationExpr> annotations) {
            for (AnnotationExpr annotation : annotations) {
                node(ANNOTATION, annotation.getNameAsString(), annotation).ifPresent(parent::addChild);
            }
        }

        private void addJavadoc(SyntaxNode parent, NodeWithJavadoc<?> documented) {
            documented.getJavadocComment()
                    .flatMap(comment -> node(JAVADOC, null, comment))
                    .ifPresent(parent::addChild);
        }

        private void addBaseTypes(SyntaxNode parent, String nodeType, NodeList<ClassOrInterfaceType> types) {
            if (types.isEmpty()) {
                return;
            }
            String names = types.stream().map(ClassOrInterfaceType::getNameWithScope).collect(Collectors.joining(", "));
            node(nodeType, names, types.get(0)).ifPresent(parent::addChild);
        }

        private Optional<SyntaxNode> node(String type, String name, Node source) {
            return source.getRange().map(range -> toSyntaxNode(type, name, range));
        }

        private SyntaxNode toSyntaxNode(String type, String name, Range range) {
            int start = index.offsetOf(range.begin.line, range.begin.column);
            int end = index.offsetOf(range.end.line, range.end.column) + 1;
            return new SyntaxNode(type, name, start, Math.max(start, end), range.begin.line, range.end.line);
        }

        private static String typeNodeType(TypeDeclaration<?> type) {
            if (type instanceof ClassOrInterfaceDeclaration declaration) {
                return declaration.isInterface() ? INTERFACE : CLASS;
            }
            if (type instanceof EnumDeclaration) {
                return ENUM;
            }
            if (type instanceof RecordDeclaration) {
                return RECORD;
            }
            return null;
        }
    }
}
