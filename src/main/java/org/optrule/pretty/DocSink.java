/*
 * Copyright 2025 The Retrospect Authors
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

package org.optrule.pretty;

/**
 * Receives the events describing a {@link Doc}. Groups are properly nested: each call to {@link
 * #beginGroup} is matched by a later call to {@link #endGroup}.
 *
 * <p>A DocSink may buffer events; {@link #close} must be called after the last event to flush
 * them.
 */
public interface DocSink extends AutoCloseable {

  void text(String s);

  /** A soft line, which continues at column {@code indent} if it is broken. */
  void line(int indent);

  /** A zero-width break, which continues at column {@code indent} if it is broken. */
  void lineBreak(int indent);

  void beginGroup();

  void endGroup();

  /** Flushes any buffered events. */
  @Override
  void close();
}
