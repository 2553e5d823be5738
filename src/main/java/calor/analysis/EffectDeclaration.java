// Copyright 2026 The Calor Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package calor.analysis;

/**
 * A declared side effect of a function, such as <code>db:w</code>. The kind is
 * a coarse classification derived from the resource name.
 *
 * @author The Calor Project Developers
 *
 */
public class EffectDeclaration {
	public enum Kind {
		IO, PROCESS, MEMORY, CONSOLE
	}

	public enum Access {
		READ("r"), WRITE("w"), READ_WRITE("rw");

		private final String symbol;

		private Access(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}

		/**
		 * Check whether data can flow out of the resource under this access.
		 */
		public boolean isReadable() {
			return this != WRITE;
		}

		/**
		 * Check whether data can flow into the resource under this access.
		 */
		public boolean isWritable() {
			return this != READ;
		}
	}

	private final Kind kind;
	private final String resource;
	private final Access access;

	public EffectDeclaration(Kind kind, String resource, Access access) {
		if (kind == null || resource == null || access == null) {
			throw new IllegalArgumentException("invalid effect declaration");
		}
		this.kind = kind;
		this.resource = resource;
		this.access = access;
	}

	public Kind getKind() {
		return kind;
	}

	public String getResource() {
		return resource;
	}

	public Access getAccess() {
		return access;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof EffectDeclaration) {
			EffectDeclaration e = (EffectDeclaration) o;
			return kind == e.kind && resource.equals(e.resource) && access == e.access;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return kind.hashCode() ^ resource.hashCode() ^ access.hashCode();
	}

	@Override
	public String toString() {
		return resource + ":" + access.getSymbol();
	}
}
