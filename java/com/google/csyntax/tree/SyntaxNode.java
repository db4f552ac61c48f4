/*
 * Copyright 2016 Google Inc. All Rights Reserved.
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

package com.google.csyntax.tree;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A node in a C# syntax tree.
 *
 * <p>Nodes are immutable and built bottom-up. Punctuation and keyword tokens are not represented;
 * a node carries the text of the one identifier, predefined-type keyword or literal that its
 * production declares as its {@link #tokenValue}.
 */
public final class SyntaxNode {

  private final SyntaxKind kind;
  private final @Nullable String tokenValue;
  private final ImmutableList<SyntaxNode> children;

  private SyntaxNode(
      SyntaxKind kind, @Nullable String tokenValue, ImmutableList<SyntaxNode> children) {
    this.kind = requireNonNull(kind);
    this.tokenValue = tokenValue;
    this.children = requireNonNull(children);
  }

  /** Creates a node. Missing ({@code null}) children are dropped. */
  public static SyntaxNode of(SyntaxKind kind, @Nullable SyntaxNode... children) {
    return of(kind, null, Arrays.asList(children));
  }

  /** Creates a node with a token value. Missing ({@code null}) children are dropped. */
  public static SyntaxNode named(
      SyntaxKind kind, @Nullable String tokenValue, @Nullable SyntaxNode... children) {
    return of(kind, tokenValue, Arrays.asList(children));
  }

  /** Creates a node. Missing ({@code null}) children are dropped. */
  public static SyntaxNode of(
      SyntaxKind kind,
      @Nullable String tokenValue,
      Iterable<? extends @Nullable SyntaxNode> children) {
    ImmutableList.Builder<SyntaxNode> builder = ImmutableList.builder();
    for (SyntaxNode child : children) {
      if (child != null) {
        builder.add(child);
      }
    }
    return new SyntaxNode(kind, tokenValue, builder.build());
  }

  public static Builder builder(SyntaxKind kind) {
    return new Builder(kind);
  }

  /** The production this node instantiates. */
  public SyntaxKind kind() {
    return kind;
  }

  /** The identifier or literal text carried by this node, if any. */
  public @Nullable String tokenValue() {
    return tokenValue;
  }

  /** The child nodes, in source order. */
  public ImmutableList<SyntaxNode> children() {
    return children;
  }

  public SyntaxNode child(int index) {
    return children.get(index);
  }

  /** Returns a copy of this node with {@code child} appended. */
  public SyntaxNode withChild(@Nullable SyntaxNode child) {
    if (child == null) {
      return this;
    }
    return new SyntaxNode(
        kind,
        tokenValue,
        ImmutableList.<SyntaxNode>builder().addAll(children).add(child).build());
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof SyntaxNode)) {
      return false;
    }
    SyntaxNode that = (SyntaxNode) obj;
    return kind == that.kind
        && Objects.equals(tokenValue, that.tokenValue)
        && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, tokenValue, children);
  }

  @Override
  public String toString() {
    return Pretty.compact(this);
  }

  /** A builder for nodes whose children are collected incrementally. */
  public static final class Builder {

    private final SyntaxKind kind;
    private @Nullable String tokenValue;
    private final ImmutableList.Builder<SyntaxNode> children = ImmutableList.builder();

    private Builder(SyntaxKind kind) {
      this.kind = kind;
    }

    @CanIgnoreReturnValue
    public Builder tokenValue(@Nullable String tokenValue) {
      this.tokenValue = tokenValue;
      return this;
    }

    /** Appends a child; {@code null} is ignored. */
    @CanIgnoreReturnValue
    public Builder add(@Nullable SyntaxNode child) {
      if (child != null) {
        children.add(child);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Iterable<SyntaxNode> nodes) {
      children.addAll(nodes);
      return this;
    }

    public SyntaxNode build() {
      return new SyntaxNode(kind, tokenValue, children.build());
    }
  }
}
