/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.gas;

import static com.google.common.truth.Truth.assertThat;

import com.google.javascript.gas.ast.IR;
import com.google.javascript.gas.ast.Node;
import com.google.javascript.gas.ast.SourceFile;
import com.google.javascript.gas.compiler.LoggerErrorManager;
import com.google.javascript.gas.compiler.parsing.Parser;
import java.util.logging.Logger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeFiltersTest {

  static Node parse(String code) {
    LoggerErrorManager errorManager =
        new LoggerErrorManager(Logger.getLogger(NodeFiltersTest.class.getName()));
    Node root = Parser.parse(SourceFile.fromCode("input.ts", code), errorManager);
    assertThat(root).isNotNull();
    return root;
  }

  private static Node parseStatement(String code) {
    return parse(code).getFirstChild();
  }

  private static Node createMarker() {
    return IR.exprResult(
        IR.assign(IR.getprop(IR.name("exports"), "__esModule"), IR.trueNode()));
  }

  @Test
  public void testIsImport() {
    assertThat(NodeFilters.isImport(parseStatement("import {a} from \"./m\";"))).isTrue();
    assertThat(NodeFilters.isImport(parseStatement("import x from \"./m\";"))).isTrue();
    assertThat(NodeFilters.isImport(parseStatement("import * as ns from \"./m\";"))).isTrue();
    assertThat(NodeFilters.isImport(parseStatement("import \"./polyfill\";"))).isTrue();
    assertThat(NodeFilters.isImport(parseStatement("import C = A.b;"))).isTrue();
    assertThat(NodeFilters.isImport(parseStatement("import m = require(\"m\");"))).isTrue();
    assertThat(NodeFilters.isImport(parseStatement("export import C = A.b;"))).isTrue();
  }

  @Test
  public void testIsImport_otherStatements() {
    assertThat(NodeFilters.isImport(parseStatement("var a = require(\"m\");"))).isFalse();
    assertThat(NodeFilters.isImport(parseStatement("export const a = 1;"))).isFalse();
    assertThat(NodeFilters.isImport(parseStatement("export {a} from \"./m\";"))).isFalse();
  }

  @Test
  public void testIsExportFrom() {
    assertThat(NodeFilters.isExportFrom(parseStatement("export * from \"./m\";"))).isTrue();
    assertThat(NodeFilters.isExportFrom(parseStatement("export * as ns from \"./m\";"))).isTrue();
    assertThat(NodeFilters.isExportFrom(parseStatement("export {a, b as c} from \"./m\";")))
        .isTrue();
  }

  @Test
  public void testIsExportFrom_localExports() {
    assertThat(NodeFilters.isExportFrom(parseStatement("var a; export {a};").getNext()))
        .isFalse();
    assertThat(NodeFilters.isExportFrom(parseStatement("export const a = 1;"))).isFalse();
    assertThat(NodeFilters.isExportFrom(parseStatement("export default \"./m\";"))).isFalse();
    assertThat(NodeFilters.isExportFrom(parseStatement("import {a} from \"./m\";"))).isFalse();
  }

  @Test
  public void testIsLoweredExportFrom() {
    Node exportFrom = parseStatement("export {a} from \"./m\";");
    Node lowered = IR.exprResult(IR.name("x")).setOriginalNode(exportFrom);
    assertThat(NodeFilters.isLoweredExportFrom(lowered)).isTrue();

    Node exportDecl = parseStatement("export const a = 1;");
    assertThat(NodeFilters.isLoweredExportFrom(IR.exprResult(IR.name("x")))).isFalse();
    assertThat(
            NodeFilters.isLoweredExportFrom(
                IR.exprResult(IR.name("x")).setOriginalNode(exportDecl)))
        .isFalse();
    assertThat(NodeFilters.isLoweredExportFrom(exportFrom)).isFalse();
  }

  @Test
  public void testGetIdentifierText() {
    Node call = parseStatement("exports.a(b);").getFirstChild();
    Node getprop = call.getFirstChild();
    assertThat(NodeFilters.getIdentifierText(getprop)).isEqualTo("a");
    assertThat(NodeFilters.getIdentifierText(getprop.getFirstChild())).isEqualTo("exports");
    assertThat(NodeFilters.getIdentifierText(call.getLastChild())).isEqualTo("b");
    assertThat(NodeFilters.getIdentifierText(call)).isNull();
    assertThat(NodeFilters.getIdentifierText(IR.string("exports"))).isNull();
    assertThat(NodeFilters.isIdentifier(IR.name(""))).isFalse();
    assertThat(NodeFilters.isIdentifier(IR.name("x"))).isTrue();
  }

  @Test
  public void testGetIdentifierTextOfPropertyKeys() {
    Node object = parseStatement("var o = {exports: 1, \"q\": 2, 3: c, get g() { return 4; }};")
        .getFirstChild()
        .getFirstChild();
    Node exportsKey = object.getFirstChild();
    assertThat(NodeFilters.getIdentifierText(exportsKey)).isEqualTo("exports");
    assertThat(NodeFilters.getIdentifierText(exportsKey.getNext())).isNull();
    assertThat(NodeFilters.getIdentifierText(exportsKey.getNext().getNext())).isNull();
    assertThat(NodeFilters.getIdentifierText(object.getLastChild())).isEqualTo("g");

    Node member = parseStatement("class C { exports() {} }").getLastChild().getFirstChild();
    assertThat(NodeFilters.getIdentifierText(member)).isEqualTo("exports");
  }

  @Test
  public void testIsModuleMarker() {
    assertThat(NodeFilters.isModuleMarker(createMarker())).isTrue();
  }

  @Test
  public void testIsModuleMarker_writtenByUser() {
    Node userMarker = parseStatement("exports.__esModule = true;");
    assertThat(NodeFilters.isModuleMarker(userMarker)).isFalse();
  }

  @Test
  public void testIsModuleMarker_otherShapes() {
    assertThat(
            NodeFilters.isModuleMarker(
                IR.exprResult(
                    IR.assign(IR.getprop(IR.name("exports"), "__esModule"), IR.nullNode()))))
        .isFalse();
    assertThat(
            NodeFilters.isModuleMarker(
                IR.exprResult(
                    IR.assign(IR.getprop(IR.name("module"), "__esModule"), IR.trueNode()))))
        .isFalse();
    assertThat(
            NodeFilters.isModuleMarker(
                IR.exprResult(IR.assign(IR.getprop(IR.name("exports"), "a"), IR.trueNode()))))
        .isFalse();
    assertThat(NodeFilters.isModuleMarker(createMarker().getFirstChild())).isFalse();
  }

  @Test
  public void testIsDefaultExportAssignment() {
    assertThat(NodeFilters.isDefaultExportAssignment(parseStatement("exports.default = a;")))
        .isTrue();
    assertThat(
            NodeFilters.isDefaultExportAssignment(
                IR.exprResult(
                    IR.assign(IR.getprop(IR.name("exports"), "default"), IR.name("_default")))))
        .isTrue();
  }

  @Test
  public void testIsDefaultExportAssignment_otherShapes() {
    assertThat(NodeFilters.isDefaultExportAssignment(parseStatement("exports.default = 1;")))
        .isFalse();
    assertThat(NodeFilters.isDefaultExportAssignment(parseStatement("exports.other = a;")))
        .isFalse();
    assertThat(NodeFilters.isDefaultExportAssignment(parseStatement("module.default = a;")))
        .isFalse();
    assertThat(NodeFilters.isDefaultExportAssignment(parseStatement("exports.default(a);")))
        .isFalse();
  }
}
