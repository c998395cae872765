package squawk.processor;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic.Kind;
import javax.tools.JavaFileObject;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates visitor plumbing for {@link ASTNode} families.
 *
 * <p>For every annotated class {@code Outer.Node} of family {@code F} this writes an interface
 * {@code Outer_Node_ASTNode} with default {@code accept} and {@code visitChildren} methods. Once
 * all rounds are done, it writes {@code FVisitor}, {@code DefaultFVisitor} and {@code
 * VoidDefaultFVisitor} for each family. The family's base interface {@code FNode} is hand-written
 * next to the nodes.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  private static final class Family {
    private final String packageName;
    private final String name;
    private final Set<String> nodes = new TreeSet<>();

    private Family(String packageName, String name) {
      this.packageName = packageName;
      this.name = name;
    }

    private ClassName visitorName() {
      return ClassName.get(packageName, name + "Visitor");
    }

    private ClassName nodeInterfaceName() {
      return ClassName.get(packageName, name + "Node");
    }
  }

  // Keyed by package and family name so the generated files come out in a stable order.
  private final Map<String, Family> families = new TreeMap<>();

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        for (Family family : families.values()) {
          generateVisitorFiles(family);
        }
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(Family family, String name, String format, TypeRenderer typeRenderer)
      throws IOException {
    JavaFileObject file =
        processingEnv.getFiler().createSourceFile(family.packageName + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              family.packageName,
              family
                  .nodes
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateVisitorFiles(Family family) throws IOException {
    String visitor = family.name + "Visitor";
    String defaultVisitor = "Default" + visitor;

    writeFile(
        family,
        visitor,
        "package %s;\n\npublic interface " + visitor + "<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        family,
        defaultVisitor,
        "package %s;\n\n"
            + "public abstract class "
            + defaultVisitor
            + "<V> implements "
            + visitor
            + "<V> {\n\n%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeFile(
        family,
        "VoidDefault" + visitor,
        "package %s;\n\n"
            + "public abstract class VoidDefault"
            + visitor
            + " extends "
            + defaultVisitor
            + "<Void> {\n\n%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName));
  }

  private static String getASTNodeClassName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return elems.stream().collect(Collectors.joining("_"));
  }

  private static final TypeVariableName V = TypeVariableName.get("V");

  private enum ChildKind {
    SINGLE,
    ITERABLE,
    OPTIONAL;
  }

  private ChildKind childKind(TypeMirror returnType) {
    Types types = processingEnv.getTypeUtils();
    TypeMirror erased = types.erasure(returnType);
    Elements elements = processingEnv.getElementUtils();
    TypeMirror iterable = types.erasure(elements.getTypeElement("java.lang.Iterable").asType());
    TypeMirror optional = types.erasure(elements.getTypeElement("java.util.Optional").asType());

    if (types.isSameType(erased, optional)) {
      return ChildKind.OPTIONAL;
    } else if (types.isAssignable(erased, iterable)) {
      return ChildKind.ITERABLE;
    } else {
      return ChildKind.SINGLE;
    }
  }

  private void writeASTNodeFile(TypeElement element, Family family) throws IOException {
    String getInterfaceName = getASTNodeClassName(element);
    if (!element
        .getInterfaces()
        .stream()
        .anyMatch(i -> TypeName.get(i).toString().endsWith(getInterfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + getInterfaceName, element);
      return;
    }

    ClassName nodeInterface = family.nodeInterfaceName();
    ParameterSpec visitorParam =
        ParameterSpec.builder(ParameterizedTypeName.get(family.visitorName(), V), "visitor")
            .build();
    ParameterSpec valueParam = ParameterSpec.builder(V, "value").build();

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(getInterfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(nodeInterface);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParam)
            .addParameter(valueParam)
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildrenMethodBuilder =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParam)
            .addParameter(valueParam);
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ASTChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      String methodName = method.getSimpleName().toString();
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(methodName)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      switch (childKind(method.getReturnType())) {
        case SINGLE:
          visitChildrenMethodBuilder.addStatement(
              "value = $L().accept(visitor, value)", methodName);
          break;
        case ITERABLE:
          visitChildrenMethodBuilder
              .beginControlFlow("for ($T child : $L())", nodeInterface, methodName)
              .addStatement("value = child.accept(visitor, value)")
              .endControlFlow();
          break;
        case OPTIONAL:
          visitChildrenMethodBuilder
              .beginControlFlow("if ($L().isPresent())", methodName)
              .addStatement("value = $L().get().accept(visitor, value)", methodName)
              .endControlFlow();
          break;
      }
    }
    typeSpecBuilder.addMethod(visitChildrenMethodBuilder.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(family.packageName, typeSpecBuilder.build()).build();
    JavaFileObject file =
        processingEnv.getFiler().createSourceFile(family.packageName + "." + getInterfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private Family family(TypeElement element) {
    String packageName =
        processingEnv.getElementUtils().getPackageOf(element).getQualifiedName().toString();
    String name = element.getAnnotation(ASTNode.class).value();
    return families.computeIfAbsent(
        packageName + "." + name, k -> new Family(packageName, name));
  }

  private void processImpl(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      Family family = family(typeElement);
      try {
        writeASTNodeFile(typeElement, family);
      } catch (Exception ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      family.nodes.add(typeElement.getQualifiedName().toString());
    }
  }
}
