// This file is part of Graphication.
// Copyright (C) 2026  The Graphication Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.graphication.graph;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;

import net.graphication.data.Range;
import net.graphication.exceptions.EmptySeriesException;
import net.graphication.utils.Pair;

/**
 * Holds the nodes of a structure diagram and the links between them. Both
 * lists keep insertion order. Links may only join nodes already in the set.
 */
public class NodeSet implements Iterable<Node> {

  private final List<Node> nodes = Lists.newArrayList();
  private final List<NodeLink> links = Lists.newArrayList();

  /**
   * Adds a node.
   * @param node A non-null node.
   * @throws IllegalArgumentException if the node was null.
   */
  public void addNode(final Node node) {
    if (node == null) {
      throw new IllegalArgumentException("Node cannot be null.");
    }
    nodes.add(node);
  }

  /**
   * Adds a link between two nodes of this set.
   * @param link A non-null link.
   * @throws IllegalArgumentException if the link was null or either end
   * isn't in this set.
   */
  public void addLink(final NodeLink link) {
    if (link == null) {
      throw new IllegalArgumentException("Link cannot be null.");
    }
    if (!nodes.contains(link.getStart())) {
      throw new IllegalArgumentException("The start node "
          + link.getStart() + " is not in this node set.");
    }
    if (!nodes.contains(link.getEnd())) {
      throw new IllegalArgumentException("The end node "
          + link.getEnd() + " is not in this node set.");
    }
    links.add(link);
  }

  /**
   * Nodes linked to the given node.
   * @param node The node to find neighbors of.
   * @param both Whether links ending at the node count too, or only links
   * starting at it.
   * @return A lazy view of (other node, link) pairs in link order.
   */
  public Iterable<Pair<Node, NodeLink>> adjacentTo(final Node node,
                                                  final boolean both) {
    return FluentIterable.from(links)
        .filter(link -> link.getStart() == node
            || (both && link.getEnd() == node))
        .transform(link -> Pair.of(
            link.getStart() == node ? link.getEnd() : link.getStart(), link));
  }

  /**
   * @return The smallest and largest node values. The span is the
   * difference.
   * @throws EmptySeriesException if there are no nodes.
   */
  public Range valueRange() {
    if (nodes.isEmpty()) {
      throw new EmptySeriesException("No nodes in the set.");
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (final Node node : nodes) {
      min = Math.min(min, node.getValue());
      max = Math.max(max, node.getValue());
    }
    return new Range(min, max);
  }

  /**
   * @param index A zero based index.
   * @return The node at the index.
   * @throws IndexOutOfBoundsException if the index is out of range.
   */
  public Node get(final int index) {
    return nodes.get(index);
  }

  /** @return The number of nodes. */
  public int size() {
    return nodes.size();
  }

  /** @return An immutable copy of the links. */
  public List<NodeLink> getLinks() {
    return ImmutableList.copyOf(links);
  }

  @Override
  public Iterator<Node> iterator() {
    return Iterators.unmodifiableIterator(nodes.iterator());
  }
}
