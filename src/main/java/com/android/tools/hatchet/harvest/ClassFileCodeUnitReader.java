// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.harvest;

import static org.objectweb.asm.ClassReader.SKIP_DEBUG;
import static org.objectweb.asm.ClassReader.SKIP_FRAMES;

import com.android.tools.hatchet.origin.CodeUnitOrigin;
import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.utils.FileUtils;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.ConstantDynamic;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Reads JVM class files.
 *
 * <p>The class body is one code unit and each method body is a nested unit. Referenced names are
 * the names of accessed fields and invoked methods, the simple names of all types mentioned in
 * instructions and descriptors, and the names of declared members, since a declared method may
 * override a virtual method of a binding type.
 */
public class ClassFileCodeUnitReader implements CodeUnitReader {

  static final int ASM_VERSION = Opcodes.ASM9;

  @Override
  public boolean accepts(String fileName) {
    return FileUtils.isClassFile(fileName);
  }

  @Override
  public CodeUnit read(Origin origin, byte[] bytes) throws MalformedCodeUnitException {
    ClassUnitBuilder builder = new ClassUnitBuilder(origin);
    try {
      new ClassReader(bytes).accept(builder, SKIP_DEBUG | SKIP_FRAMES);
    } catch (RuntimeException e) {
      // ASM signals malformed input with IllegalArgumentException or index exceptions.
      throw new MalformedCodeUnitException(origin, "Invalid class file: " + e, e);
    }
    return builder.build();
  }

  static void addInternalName(BasicCodeUnit.Builder builder, String internalName) {
    if (internalName == null) {
      return;
    }
    if (internalName.startsWith("[")) {
      addDescriptor(builder, internalName);
      return;
    }
    String simpleName = internalName.substring(internalName.lastIndexOf('/') + 1);
    for (String part : simpleName.split("\\$")) {
      if (!part.isEmpty()) {
        builder.addReferencedName(part);
      }
    }
  }

  static void addDescriptor(BasicCodeUnit.Builder builder, String descriptor) {
    if (descriptor == null) {
      return;
    }
    Type type = Type.getType(descriptor);
    if (type.getSort() == Type.METHOD) {
      addType(builder, type.getReturnType());
      for (Type argumentType : type.getArgumentTypes()) {
        addType(builder, argumentType);
      }
    } else {
      addType(builder, type);
    }
  }

  private static void addType(BasicCodeUnit.Builder builder, Type type) {
    if (type.getSort() == Type.ARRAY) {
      type = type.getElementType();
    }
    if (type.getSort() == Type.OBJECT) {
      addInternalName(builder, type.getInternalName());
    }
  }

  static void addHandle(BasicCodeUnit.Builder builder, Handle handle) {
    addInternalName(builder, handle.getOwner());
    builder.addReferencedName(handle.getName());
    addDescriptor(builder, handle.getDesc());
  }

  static void addConstant(BasicCodeUnit.Builder builder, Object value) {
    if (value instanceof String) {
      builder.addStringConstant((String) value);
    } else if (value instanceof Type) {
      Type type = (Type) value;
      if (type.getSort() == Type.METHOD) {
        addDescriptor(builder, type.getDescriptor());
      } else {
        addType(builder, type);
      }
    } else if (value instanceof Handle) {
      addHandle(builder, (Handle) value);
    } else if (value instanceof ConstantDynamic) {
      ConstantDynamic constantDynamic = (ConstantDynamic) value;
      builder.addReferencedName(constantDynamic.getName());
      addDescriptor(builder, constantDynamic.getDescriptor());
      addHandle(builder, constantDynamic.getBootstrapMethod());
      for (int i = 0; i < constantDynamic.getBootstrapMethodArgumentCount(); i++) {
        addConstant(builder, constantDynamic.getBootstrapMethodArgument(i));
      }
    }
  }

  private static class ClassUnitBuilder extends ClassVisitor {

    private final Origin origin;
    private final BasicCodeUnit.Builder builder;
    private final List<MethodUnitBuilder> methods = new ArrayList<>();

    ClassUnitBuilder(Origin origin) {
      super(ASM_VERSION);
      this.origin = origin;
      this.builder = BasicCodeUnit.builder(origin);
    }

    @Override
    public void visit(
        int version,
        int access,
        String name,
        String signature,
        String superName,
        String[] interfaces) {
      addInternalName(builder, name);
      addInternalName(builder, superName);
      if (interfaces != null) {
        for (String iface : interfaces) {
          addInternalName(builder, iface);
        }
      }
    }

    @Override
    public FieldVisitor visitField(
        int access, String name, String descriptor, String signature, Object value) {
      builder.addReferencedName(name);
      addDescriptor(builder, descriptor);
      if (value != null) {
        addConstant(builder, value);
      }
      return null;
    }

    @Override
    public MethodVisitor visitMethod(
        int access, String name, String descriptor, String signature, String[] exceptions) {
      builder.addReferencedName(name);
      addDescriptor(builder, descriptor);
      MethodUnitBuilder method =
          new MethodUnitBuilder(new CodeUnitOrigin(name + descriptor, origin));
      methods.add(method);
      return method;
    }

    CodeUnit build() {
      for (MethodUnitBuilder method : methods) {
        builder.addNestedUnit(method.build());
      }
      return builder.build();
    }
  }

  private static class MethodUnitBuilder extends MethodVisitor {

    private final BasicCodeUnit.Builder builder;

    MethodUnitBuilder(Origin origin) {
      super(ASM_VERSION);
      this.builder = BasicCodeUnit.builder(origin);
    }

    @Override
    public void visitTypeInsn(int opcode, String type) {
      addInternalName(builder, type);
    }

    @Override
    public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
      addInternalName(builder, owner);
      builder.addReferencedName(name);
      addDescriptor(builder, descriptor);
    }

    @Override
    public void visitMethodInsn(
        int opcode, String owner, String name, String descriptor, boolean isInterface) {
      addInternalName(builder, owner);
      builder.addReferencedName(name);
      addDescriptor(builder, descriptor);
    }

    @Override
    public void visitInvokeDynamicInsn(
        String name, String descriptor, Handle bootstrapMethodHandle, Object... arguments) {
      builder.addReferencedName(name);
      addDescriptor(builder, descriptor);
      addHandle(builder, bootstrapMethodHandle);
      for (Object argument : arguments) {
        addConstant(builder, argument);
      }
    }

    @Override
    public void visitLdcInsn(Object value) {
      addConstant(builder, value);
    }

    @Override
    public void visitMultiANewArrayInsn(String descriptor, int numDimensions) {
      addDescriptor(builder, descriptor);
    }

    @Override
    public void visitTryCatchBlock(Label start, Label end, Label handler, String type) {
      addInternalName(builder, type);
    }

    CodeUnit build() {
      return builder.build();
    }
  }
}
