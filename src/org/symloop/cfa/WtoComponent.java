// This file is part of SymLoop,
// a fixpoint engine for loops under symbolic execution.
//
// SPDX-FileCopyrightText: 2024 The SymLoop Authors
//
// SPDX-License-Identifier: Apache-2.0

package org.symloop.cfa;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * A component of a weak topological ordering: either a single block, or a strongly connected
 * component with its head and the ordering of its remaining blocks.
 */
public abstract class WtoComponent {

  private WtoComponent() {}

  /** All blocks of this component, head first. */
  public abstract ImmutableList<BlockId> flatten();

  static Vertex vertex(BlockId pBlock) {
    return new Vertex(pBlock);
  }

  static Scc scc(BlockId pHead, ImmutableList<WtoComponent> pComponents) {
    return new Scc(pHead, pComponents);
  }

  public static final class Vertex extends WtoComponent {
    private final BlockId block;

    private Vertex(BlockId pBlock) {
      block = checkNotNull(pBlock);
    }

    public BlockId getBlock() {
      return block;
    }

    @Override
    public ImmutableList<BlockId> flatten() {
      return ImmutableList.of(block);
    }

    @Override
    public String toString() {
      return block.toString();
    }
  }

  public static final class Scc extends WtoComponent {
    private final BlockId head;
    private final ImmutableList<WtoComponent> components;

    private Scc(BlockId pHead, ImmutableList<WtoComponent> pComponents) {
      head = checkNotNull(pHead);
      components = checkNotNull(pComponents);
    }

    public BlockId getHead() {
      return head;
    }

    public ImmutableList<WtoComponent> getComponents() {
      return components;
    }

    /** Whether another loop is nested in this one. */
    public boolean hasNestedScc() {
      return components.stream().anyMatch(component -> component instanceof Scc);
    }

    @Override
    public ImmutableList<BlockId> flatten() {
      ImmutableList.Builder<BlockId> blocks = ImmutableList.builder();
      blocks.add(head);
      for (WtoComponent component : components) {
        blocks.addAll(component.flatten());
      }
      return blocks.build();
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(").append(head);
      for (WtoComponent component : components) {
        sb.append(' ').append(component);
      }
      return sb.append(')').toString();
    }
  }
}
