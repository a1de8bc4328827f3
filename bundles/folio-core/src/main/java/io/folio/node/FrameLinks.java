/*
 * Copyright (c) 2023, Folio Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.folio.node;

import com.google.common.base.MoreObjects;
import io.folio.settings.Fixed;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Structural links of a frame inside its {@link FrameTree}. All links are frame keys,
 * {@link Fixed#NULL_FRAME_KEY} meaning "no such frame".
 */
final class FrameLinks {

  private static final long NULL_KEY = Fixed.NULL_FRAME_KEY.getStandardProperty();

  /** Key of the parent frame. */
  private long parent = NULL_KEY;

  /** Key of the first child. */
  private long firstChild = NULL_KEY;

  /** Key of the last child. */
  private long lastChild = NULL_KEY;

  /** Key of the left sibling. */
  private long leftSibling = NULL_KEY;

  /** Key of the right sibling. */
  private long rightSibling = NULL_KEY;

  /** Number of children. */
  private int childCount;

  boolean hasParent() {
    return parent != NULL_KEY;
  }

  boolean hasFirstChild() {
    return firstChild != NULL_KEY;
  }

  boolean hasLastChild() {
    return lastChild != NULL_KEY;
  }

  boolean hasLeftSibling() {
    return leftSibling != NULL_KEY;
  }

  boolean hasRightSibling() {
    return rightSibling != NULL_KEY;
  }

  long getParentKey() {
    return parent;
  }

  void setParentKey(final long key) {
    parent = key;
  }

  long getFirstChildKey() {
    return firstChild;
  }

  void setFirstChildKey(final long key) {
    firstChild = key;
  }

  long getLastChildKey() {
    return lastChild;
  }

  void setLastChildKey(final long key) {
    lastChild = key;
  }

  long getLeftSiblingKey() {
    return leftSibling;
  }

  void setLeftSiblingKey(final long key) {
    leftSibling = key;
  }

  long getRightSiblingKey() {
    return rightSibling;
  }

  void setRightSiblingKey(final long key) {
    rightSibling = key;
  }

  @NonNegative
  int getChildCount() {
    return childCount;
  }

  void incrementChildCount() {
    childCount++;
  }

  void decrementChildCount() {
    childCount--;
  }

  /** Forget parent and siblings, keeping the children. */
  void detach() {
    parent = NULL_KEY;
    leftSibling = NULL_KEY;
    rightSibling = NULL_KEY;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("parent", parent)
                      .add("firstChild", firstChild)
                      .add("lastChild", lastChild)
                      .add("leftSibling", leftSibling)
                      .add("rightSibling", rightSibling)
                      .add("childCount", childCount)
                      .toString();
  }
}
