/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.optree.common.lang;

/**
 * Opaque reference to the source range an operation came from.
 * Only used for diagnostics, never for semantic decisions.
 */
public class SourceLocus {
  private final String language;
  private final String file;
  private final int start;
  private final int length;

  public SourceLocus(String language, String file, int start, int length) {
    assert(language != null);
    assert(start >= 0 && length >= 0) : start + " " + length;
    this.language = language;
    this.file = file;
    this.start = start;
    this.length = length;
  }

  /** @return name of the surface language that produced the syntax */
  public String language() {
    return language;
  }

  /** @return source file, or null if not from a file */
  public String file() {
    return file;
  }

  public int start() {
    return start;
  }

  public int length() {
    return length;
  }

  public int end() {
    return start + length;
  }

  public boolean contains(SourceLocus other) {
    return equalFiles(file, other.file) && start <= other.start &&
           other.end() <= end();
  }

  private static boolean equalFiles(String a, String b) {
    return a == null ? b == null : a.equals(b);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + language.hashCode();
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + start;
    result = prime * result + length;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourceLocus))
      return false;
    SourceLocus other = (SourceLocus) obj;
    return language.equals(other.language) && equalFiles(file, other.file)
        && start == other.start && length == other.length;
  }

  @Override
  public String toString() {
    return (file == null ? "<unknown>" : file) + "[" + start + ".." +
            end() + ")";
  }
}
