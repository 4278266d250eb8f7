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

package com.google.javascript.gas.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} is the last child,
 * and the last child's {@code next} is null. A node carries the source range {@code [start, end)}
 * it was parsed from; nodes built by the compiler keep the sentinel range {@code [-1, -1)}.
 */
public class Node {

  /** Sentinel used for the source offsets of nodes that do not come from source text. */
  public static final int NO_POSITION = -1;

  /** Properties that can be attached to a node. */
  public enum Prop {
    // Set if the node is an arrow function.
    ARROW_FN,
    // Set if the node is a Generator function or member method.
    GENERATOR_FN,
    ASYNC_FN,
    // Set if class member definition is static
    STATIC_MEMBER,
    // Set to indicate a quoted object lit key
    QUOTED,
    // Whether incrdecr is pre (false) or post (true)
    INCRDECR,
    // Set if a export is a "default" export
    EXPORT_DEFAULT,
    // Set if an export is a "*"
    EXPORT_ALL_FROM,
    // An import or export that only names types.
    TYPE_ONLY,
    // A `const enum` declaration.
    CONST_ENUM,
    // A constructor parameter with an accessibility or readonly modifier.
    PARAMETER_PROPERTY,
    // Indicate that a OPTCHAIN_GETPROP, OPTCHAIN_GETELEM, or OPTCHAIN_CALL is the start of an
    // optional chain.
    START_OF_OPT_CHAIN,
    // A synthetic block, e.g. the body of a CASE.
    SYNTHETIC,
    // The raw text of a template literal string.
    RAW_STRING,
    // The printer must not hand this node to substitution hooks.
    NO_SUBSTITUTION,
    // The source node a synthesized node was produced from.
    ORIGINAL_NODE,
    // The SourceFile of a SCRIPT.
    SOURCE_FILE,
    // Indicates that a SCRIPT node is or was an ES module.
    ES6_MODULE,
    LEADING_COMMENTS,
    TRAILING_COMMENTS,
    // Comments before the closing brace of a block or the end of a script.
    DANGLING_COMMENTS,
    // Text of the line comment printed in place of a NOT_EMITTED node.
    SYNTHETIC_COMMENT,
    // Names that print as a property access inside the scope rooted at this node.
    EXPORT_BINDINGS,
    // Decorator expressions applied to a class, member or parameter.
    DECORATORS,
  }

  private abstract static class PropListItem {
    final @Nullable PropListItem next;
    final byte propType;

    PropListItem(byte propType, @Nullable PropListItem next) {
      this.propType = propType;
      this.next = next;
    }

    public abstract int getIntValue();

    public abstract Object getObjectValue();

    public abstract PropListItem chain(@Nullable PropListItem next);
  }

  private static final class ObjectPropListItem extends PropListItem {
    private final Object objectValue;

    ObjectPropListItem(byte propType, Object objectValue, @Nullable PropListItem next) {
      super(propType, next);
      this.objectValue = checkNotNull(objectValue);
    }

    @Override
    public int getIntValue() {
      throw new UnsupportedOperationException();
    }

    @Override
    public Object getObjectValue() {
      return objectValue;
    }

    @Override
    public String toString() {
      return String.valueOf(objectValue);
    }

    @Override
    public PropListItem chain(@Nullable PropListItem next) {
      return new ObjectPropListItem(propType, objectValue, next);
    }
  }

  private static final class IntPropListItem extends PropListItem {
    final int intValue;

    IntPropListItem(byte propType, int intValue, @Nullable PropListItem next) {
      super(propType, next);
      this.intValue = intValue;
      checkState(this.intValue != 0);
    }

    @Override
    public int getIntValue() {
      return intValue;
    }

    @Override
    public Object getObjectValue() {
      throw new UnsupportedOperationException();
    }

    @Override
    public String toString() {
      return String.valueOf(intValue);
    }

    @Override
    public PropListItem chain(@Nullable PropListItem next) {
      return new IntPropListItem(propType, intValue, next);
    }
  }

  private Token token;
  private @Nullable String string;
  private double number;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable PropListItem propListHead;

  private int start = NO_POSITION;
  private int end = NO_POSITION;
  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    this.first = child;

    child.checkDetached();
    // child.next remains null;
    child.previous = child;
    child.parent = this;
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    this.first = left;

    left.checkDetached();
    left.next = right;
    left.previous = right;
    left.parent = this;

    right.checkDetached();
    // right.next remains null;
    right.previous = left;
    right.parent = this;
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    this.first = left;

    left.checkDetached();
    left.next = mid;
    left.previous = right;
    left.parent = this;

    mid.checkDetached();
    mid.next = right;
    mid.previous = left;
    mid.parent = this;

    right.checkDetached();
    // right.next remains null;
    right.previous = mid;
    right.parent = this;
  }

  public static Node newNumber(double number) {
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public static Node newString(String str) {
    return newString(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public static Node newTemplateLitString(String cooked, String raw) {
    Node n = newString(Token.TEMPLATELIT_STRING, cooked);
    n.putProp(Prop.RAW_STRING, raw);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final void setToken(Token token) {
    this.token = token;
  }

  // ==========================================================================
  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild());
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getIndexOfChild(Node child) {
    Node n = first;
    int i = 0;
    while (n != null) {
      if (child == n) {
        return i;
      }
      n = n.next;
      i++;
    }
    return -1;
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    child.next = first;
    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
    } else {
      Node last = first.previous;
      // NOTE: last.next remains null
      child.previous = last;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /** Adds each node of a list, in order, to the back of this node. */
  public final void addChildrenToBack(List<Node> children) {
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  /** Inserts each node of a list, in order, at the front of this node. */
  public final void addChildrenToFront(List<Node> children) {
    for (int i = children.size() - 1; i >= 0; i--) {
      addChildToFront(children.get(i));
    }
  }

  public final void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingNext = existing.next;

    this.parent = existingParent;

    existing.next = this;
    this.previous = existing;

    if (existingNext == null) {
      existingParent.first.previous = this;
      // this.next remains null
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingPrevious = existing.previous;

    this.parent = existingParent;

    this.next = existing;
    existing.previous = this;

    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
      // existingPrevious.next remains null
    } else {
      // existingParent.first remains existing
      existingPrevious.next = this;
    }
  }

  /** Swaps `replacement` and its subtree into the position of `this`. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child, which can cause many of
    // the variables to point to the same object.

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = replacement;
      // replacement.next remains null
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Replaces this node with a list of nodes, in order. An empty list just detaches it. */
  public final void replaceWith(List<Node> replacements) {
    this.checkAttached();
    for (Node replacement : replacements) {
      replacement.insertBefore(this);
    }
    this.detach();
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child or has a single sibling,
    // which can cause many of the variables to point to the same object.

    this.parent = null;

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = existingNext;
    }

    return this;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  /**
   * Removes the first child of Node. Equivalent to: node.removeChild(node.getFirstChild());
   *
   * @return The removed Node.
   */
  @CanIgnoreReturnValue
  public final @Nullable Node removeFirstChild() {
    Node child = first;
    if (child != null) {
      child.detach();
    }
    return child;
  }

  /** Removes all children from this node and returns them, isolated from each other. */
  @CanIgnoreReturnValue
  public final List<Node> detachChildren() {
    List<Node> children = new ArrayList<>();
    for (Node child = first; child != null; ) {
      Node nextChild = child.next;
      child.parent = null;
      child.next = null;
      child.previous = null;
      children.add(child);
      child = nextChild;
    }
    first = null;
    return children;
  }

  /**
   * Return an iterable object that iterates over this node's children. The iterator does not
   * support the optional operation {@link Iterator#remove()}.
   *
   * <p>Do not detach the current child while iterating; take a snapshot with {@link
   * #childList()} instead.
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    } else {
      return new SiblingNodeIterable(first);
    }
  }

  /** Returns a snapshot of the children, safe to iterate while the tree is being edited. */
  public final ImmutableList<Node> childList() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node child = first; child != null; child = child.next) {
      builder.add(child);
    }
    return builder.build();
  }

  private static final class SiblingNodeIterable implements Iterable<Node> {
    private final Node start;

    SiblingNodeIterable(Node start) {
      this.start = start;
    }

    @Override
    public Iterator<Node> iterator() {
      return new SiblingNodeIterator(start);
    }
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.getNext();
      return n;
    }
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  public final boolean isDescendantOf(Node node) {
    for (Node n = this.parent; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  public final boolean isFirstChildOf(Node possibleParent) {
    return possibleParent == parent && this == possibleParent.first;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next.next == null;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  // ==========================================================================
  // Values

  public final double getDouble() {
    checkState(token == Token.NUMBER, "Not a NUMBER: %s", token);
    return number;
  }

  public final String getString() {
    checkState(string != null, "%s has no string value", token);
    return string;
  }

  public final void setString(String str) {
    this.string = checkNotNull(str);
  }

  /** Returns the raw text of a TEMPLATELIT_STRING. */
  public final String getRawString() {
    Object raw = getProp(Prop.RAW_STRING);
    return raw != null ? (String) raw : getString();
  }

  // ==========================================================================
  // Properties

  private @Nullable PropListItem lookupProperty(Prop prop) {
    byte propType = (byte) prop.ordinal();
    PropListItem x = propListHead;
    while (x != null && propType != x.propType) {
      x = x.next;
    }
    return x;
  }

  public final @Nullable Object getProp(Prop propType) {
    PropListItem item = lookupProperty(propType);
    if (item == null) {
      return null;
    }
    return item.getObjectValue();
  }

  public final boolean getBooleanProp(Prop propType) {
    PropListItem item = lookupProperty(propType);
    return item != null && item.getIntValue() != 0;
  }

  public final void putProp(Prop prop, @Nullable Object value) {
    this.propListHead = removeProp(propListHead, (byte) prop.ordinal());
    if (value != null) {
      propListHead = new ObjectPropListItem((byte) prop.ordinal(), value, propListHead);
    }
  }

  public final void putBooleanProp(Prop prop, boolean value) {
    this.propListHead = removeProp(propListHead, (byte) prop.ordinal());
    if (value) {
      propListHead = new IntPropListItem((byte) prop.ordinal(), 1, propListHead);
    }
  }

  /**
   * Returns a list of props with the given prop removed, rebuilding the part of the chain in front
   * of it since list items are shared between clones.
   */
  private static @Nullable PropListItem removeProp(@Nullable PropListItem item, byte propType) {
    if (item == null) {
      return null;
    } else if (item.propType == propType) {
      return item.next;
    } else {
      PropListItem result = removeProp(item.next, propType);
      if (result != item.next) {
        return item.chain(result);
      } else {
        return item;
      }
    }
  }

  public final boolean isArrowFunction() {
    return getBooleanProp(Prop.ARROW_FN);
  }

  public final boolean isGeneratorFunction() {
    return getBooleanProp(Prop.GENERATOR_FN);
  }

  public final boolean isAsyncFunction() {
    return getBooleanProp(Prop.ASYNC_FN);
  }

  public final boolean isStaticMember() {
    return getBooleanProp(Prop.STATIC_MEMBER);
  }

  public final void setStaticMember(boolean value) {
    putBooleanProp(Prop.STATIC_MEMBER, value);
  }

  public final boolean isQuotedString() {
    return getBooleanProp(Prop.QUOTED);
  }

  public final void setQuotedString() {
    putBooleanProp(Prop.QUOTED, true);
  }

  public final boolean isExportDefault() {
    return getBooleanProp(Prop.EXPORT_DEFAULT);
  }

  public final boolean isExportAllFrom() {
    return getBooleanProp(Prop.EXPORT_ALL_FROM);
  }

  public final boolean isTypeOnly() {
    return getBooleanProp(Prop.TYPE_ONLY);
  }

  /** Whether an INC or DEC is postfix. */
  public final boolean isPostfix() {
    return getBooleanProp(Prop.INCRDECR);
  }

  public final boolean isOptionalChainStart() {
    return getBooleanProp(Prop.START_OF_OPT_CHAIN);
  }

  /** Whether emit-time substitution hooks must leave this node alone. */
  public final boolean isNoSubstitution() {
    return getBooleanProp(Prop.NO_SUBSTITUTION);
  }

  public final void setNoSubstitution(boolean value) {
    putBooleanProp(Prop.NO_SUBSTITUTION, value);
  }

  public final @Nullable Node getOriginalNode() {
    return (Node) getProp(Prop.ORIGINAL_NODE);
  }

  @CanIgnoreReturnValue
  public final Node setOriginalNode(@Nullable Node original) {
    putProp(Prop.ORIGINAL_NODE, original);
    return this;
  }

  /** Whether this SCRIPT had module syntax when it was parsed. */
  public final boolean isModuleScript() {
    return getBooleanProp(Prop.ES6_MODULE);
  }

  // ==========================================================================
  // Comments

  public final ImmutableList<Comment> getLeadingComments() {
    return getComments(Prop.LEADING_COMMENTS);
  }

  public final ImmutableList<Comment> getTrailingComments() {
    return getComments(Prop.TRAILING_COMMENTS);
  }

  public final ImmutableList<Comment> getDanglingComments() {
    return getComments(Prop.DANGLING_COMMENTS);
  }

  @SuppressWarnings("unchecked")
  private ImmutableList<Comment> getComments(Prop prop) {
    Object comments = getProp(prop);
    return comments == null ? ImmutableList.of() : (ImmutableList<Comment>) comments;
  }

  public final void setLeadingComments(List<Comment> comments) {
    putProp(Prop.LEADING_COMMENTS, comments.isEmpty() ? null : ImmutableList.copyOf(comments));
  }

  public final void setTrailingComments(List<Comment> comments) {
    putProp(Prop.TRAILING_COMMENTS, comments.isEmpty() ? null : ImmutableList.copyOf(comments));
  }

  public final void setDanglingComments(List<Comment> comments) {
    putProp(Prop.DANGLING_COMMENTS, comments.isEmpty() ? null : ImmutableList.copyOf(comments));
  }

  /** Moves leading and trailing comments from another node onto this one. */
  @CanIgnoreReturnValue
  public final Node takeCommentsFrom(Node other) {
    setLeadingComments(other.getLeadingComments());
    setTrailingComments(other.getTrailingComments());
    other.setLeadingComments(ImmutableList.of());
    other.setTrailingComments(ImmutableList.of());
    return this;
  }

  public final @Nullable String getSyntheticComment() {
    return (String) getProp(Prop.SYNTHETIC_COMMENT);
  }

  public final void setSyntheticComment(@Nullable String text) {
    putProp(Prop.SYNTHETIC_COMMENT, text);
  }

  @SuppressWarnings("unchecked")
  public final ImmutableList<Node> getDecorators() {
    Object decorators = getProp(Prop.DECORATORS);
    return decorators == null ? ImmutableList.of() : (ImmutableList<Node>) decorators;
  }

  public final void setDecorators(List<Node> decorators) {
    putProp(Prop.DECORATORS, decorators.isEmpty() ? null : ImmutableList.copyOf(decorators));
  }

  // ==========================================================================
  // Export bindings

  /**
   * Returns the names that print as another expression inside the scope rooted at this node,
   * e.g. an exported variable {@code x} that prints as {@code exports.x}.
   */
  @SuppressWarnings("unchecked")
  public final ImmutableMap<String, Node> getExportBindings() {
    Object bindings = getProp(Prop.EXPORT_BINDINGS);
    return bindings == null ? ImmutableMap.of() : (ImmutableMap<String, Node>) bindings;
  }

  /** Records that references to {@code name} inside this scope print as {@code replacement}. */
  public final void addExportBinding(String name, Node replacement) {
    ImmutableMap<String, Node> existing = getExportBindings();
    if (existing.containsKey(name)) {
      return;
    }
    putProp(
        Prop.EXPORT_BINDINGS,
        ImmutableMap.<String, Node>builder()
            .putAll(existing)
            .put(name, replacement)
            .buildOrThrow());
  }

  // ==========================================================================
  // Source information

  public final int getSourceStart() {
    return start;
  }

  public final int getSourceEnd() {
    return end;
  }

  public final void setSourceRange(int start, int end) {
    this.start = start;
    this.end = end;
  }

  /** Whether this node carries the sentinel range of a compiler-built node. */
  public final boolean isSynthetic() {
    return start == NO_POSITION && end == NO_POSITION;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  /** Copies the source position, not the range, of another node. */
  @CanIgnoreReturnValue
  public final Node srcref(Node other) {
    this.lineno = other.lineno;
    this.charno = other.charno;
    return this;
  }

  /** Copies the source position of another node onto every node of this subtree. */
  @CanIgnoreReturnValue
  public final Node srcrefTree(Node other) {
    srcref(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTree(other);
    }
    return this;
  }

  /** Returns the file this node was parsed from, by looking up its SCRIPT. */
  public final @Nullable SourceFile getSourceFile() {
    for (Node n = this; n != null; n = n.parent) {
      if (n.token == Token.SCRIPT) {
        return (SourceFile) n.getProp(Prop.SOURCE_FILE);
      }
    }
    return null;
  }

  public final void setSourceFile(SourceFile file) {
    checkState(token == Token.SCRIPT, "Only a SCRIPT owns a source file");
    putProp(Prop.SOURCE_FILE, file);
  }

  public final @Nullable String getSourceFileName() {
    SourceFile file = getSourceFile();
    return file == null ? null : file.getName();
  }

  /**
   * Returns the source text this node was parsed from, or null for a synthetic or detached node.
   */
  public final @Nullable String getSourceText() {
    SourceFile file = getSourceFile();
    if (file == null || start < 0 || end < start) {
      return null;
    }
    return file.getText(start, end);
  }

  // ==========================================================================
  // Cloning

  /** Returns a copy of this node, without its children. */
  public final Node cloneNode() {
    Node clone = new Node(token);
    clone.string = string;
    clone.number = number;
    clone.propListHead = propListHead;
    clone.start = start;
    clone.end = end;
    clone.lineno = lineno;
    clone.charno = charno;
    return clone;
  }

  /** Returns a copy of this node and its subtree. */
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node child = first; child != null; child = child.next) {
      result.addChildToBack(child.cloneTree());
    }
    return result;
  }

  // ==========================================================================
  // Names

  /** Returns the dotted name this node spells, e.g. {@code a.b.c}, or null. */
  public final @Nullable String getQualifiedName() {
    switch (token) {
      case NAME:
        String name = getString();
        return name.isEmpty() ? null : name;
      case GETPROP:
        String left = first.getQualifiedName();
        return left == null ? null : left + "." + getString();
      case THIS:
        return "this";
      default:
        return null;
    }
  }

  public final boolean isQualifiedName() {
    return getQualifiedName() != null;
  }

  /** Whether this is a NAME with the given string. */
  public final boolean matchesName(String name) {
    return token == Token.NAME && name.equals(string);
  }

  public final boolean matchesQualifiedName(String name) {
    return name.equals(getQualifiedName());
  }

  // ==========================================================================
  // Token predicates

  public final boolean isAdd() {
    return token == Token.ADD;
  }

  public final boolean isArrayLit() {
    return token == Token.ARRAYLIT;
  }

  public final boolean isArrayPattern() {
    return token == Token.ARRAY_PATTERN;
  }

  public final boolean isAssign() {
    return token == Token.ASSIGN;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isClass() {
    return token == Token.CLASS;
  }

  public final boolean isConst() {
    return token == Token.CONST;
  }

  public final boolean isDefaultValue() {
    return token == Token.DEFAULT_VALUE;
  }

  public final boolean isDestructuringLhs() {
    return token == Token.DESTRUCTURING_LHS;
  }

  public final boolean isDestructuringPattern() {
    return token == Token.OBJECT_PATTERN || token == Token.ARRAY_PATTERN;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isEnum() {
    return token == Token.ENUM;
  }

  public final boolean isExport() {
    return token == Token.EXPORT;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isForOf() {
    return token == Token.FOR_OF;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isImport() {
    return token == Token.IMPORT;
  }

  public final boolean isImportEquals() {
    return token == Token.IMPORT_EQUALS;
  }

  public final boolean isIterRest() {
    return token == Token.ITER_REST;
  }

  public final boolean isIterSpread() {
    return token == Token.ITER_SPREAD;
  }

  public final boolean isLet() {
    return token == Token.LET;
  }

  public final boolean isMemberFunctionDef() {
    return token == Token.MEMBER_FUNCTION_DEF;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNamespace() {
    return token == Token.NAMESPACE;
  }

  public final boolean isNotEmitted() {
    return token == Token.NOT_EMITTED;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isObjectLit() {
    return token == Token.OBJECTLIT;
  }

  public final boolean isObjectPattern() {
    return token == Token.OBJECT_PATTERN;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isStringKey() {
    return token == Token.STRING_KEY;
  }

  public final boolean isStringLit() {
    return token == Token.STRINGLIT;
  }

  public final boolean isSuper() {
    return token == Token.SUPER;
  }

  public final boolean isThis() {
    return token == Token.THIS;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  /** Whether this is a VAR, LET or CONST declaration. */
  public final boolean isNameDeclaration() {
    return token == Token.VAR || token == Token.LET || token == Token.CONST;
  }

  // ==========================================================================
  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    if (isSynthetic()) {
      sb.append(" [synthetic]");
    }
    return sb.toString();
  }

  /** Returns an indented dump of this subtree, one node per line. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    sb.append("    ".repeat(level)).append(this).append('\n');
    for (Node child = first; child != null; child = child.next) {
      child.appendStringTree(sb, level + 1);
    }
  }
}
