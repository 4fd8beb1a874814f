/*
 * Copyright 2026 The JsCrunch Authors.
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

package org.jscrunch.compiler;

import org.jscrunch.ast.IR;
import org.jscrunch.ast.Node;
import org.jscrunch.ast.TokenUtil;
import org.jspecify.annotations.Nullable;

/**
 * Converts property accesses from bracket access syntax to dot syntax, where possible. Dot syntax
 * is more compact.
 *
 * <p>Besides the peephole rewrite of {@code obj["name"]}, the folders call {@link
 * #replaceBracketMember} whenever they compute a string that is about to become a member name.
 * That path also applies the manual property rename table.
 */
class ConvertToDottedProperties extends AbstractPeepholeOptimization {

  @Override
  Node optimizeSubtree(Node n) {
    if (!n.isGetElem() || !isAllowed(TreeModification.BRACKET_MEMBER_TO_DOT_MEMBER)) {
      return n;
    }
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    if (right.isStringLit()
        && !right.mayHaveIssues()
        && TokenUtil.isSafePropertyName(right.getString())) {
      Node newGetProp = IR.getprop(left.detach(), right.getString());
      n.replaceWith(newGetProp);
      reportChange();
      return newGetProp;
    }
    return n;
  }

  /**
   * Puts {@code literal} in place of {@code n} when {@code n} is the member name of a bracketed
   * member access and the new literal is a string. The member access becomes a dotted one if the
   * name allows it; a renamed name that does not stays bracketed.
   *
   * @return the node that took the place of {@code n} or of its member access, or null if {@code
   *     n} is not a member name and the caller still has to replace it
   */
  static @Nullable Node replaceBracketMember(Node n, Node literal, CrunchOptions options) {
    Node getElem = n.getParent();
    if (getElem == null
        || !getElem.isGetElem()
        || n != getElem.getLastChild()
        || !literal.isStringLit()
        || literal.mayHaveIssues()) {
      return null;
    }
    boolean dotAllowed =
        options.isModificationAllowed(TreeModification.BRACKET_MEMBER_TO_DOT_MEMBER);
    String name = literal.getString();

    if (options.hasRenamePairs()
        && options.getManualRenamesProperties()
        && options.isModificationAllowed(TreeModification.PROPERTY_RENAMING)) {
      String newName = options.getNewName(name);
      if (newName != null) {
        if (dotAllowed && TokenUtil.isSafePropertyName(newName)) {
          return toDotted(getElem, newName);
        }
        Node renamed = IR.string(newName);
        NodeUtil.replaceWithLiteral(n, renamed);
        return renamed;
      }
    }

    if (dotAllowed && TokenUtil.isSafePropertyName(name)) {
      return toDotted(getElem, name);
    }
    return null;
  }

  private static Node toDotted(Node getElem, String name) {
    Node newGetProp = IR.getprop(getElem.getFirstChild().detach(), name);
    getElem.replaceWith(newGetProp);
    return newGetProp;
  }
}
