// Copyright 2020 The Whiley Project Developers
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
package wysilicon.verifier;

import wysilicon.core.SilFile;
import wysilicon.io.SilFilePrinter;

/**
 * The underlying cause of a verification error, such as a receiver which may
 * be null or a permission which may not be held.
 */
public final class ErrorReason {

	public enum Kind {
		RECEIVER_NULL(6100, "Receiver might be null"),
		NEGATIVE_PERMISSION(6101, "Fraction might be negative"),
		ASSERTION_FALSE(6102, "Assertion might not hold"),
		NAMED_MAGIC_WAND_CHUNK_NOT_FOUND(6103, "Magic wand bound to variable might not be held"),
		INSUFFICIENT_PERMISSION(6104, "There might be insufficient permission"),
		MAGIC_WAND_CHUNK_NOT_FOUND(6105, "Magic wand might not be held"),
		DIVISION_BY_ZERO(6106, "Divisor might be zero");

		private final int code;
		private final String message;

		private Kind(int code, String message) {
			this.code = code;
			this.message = message;
		}

		public int getCode() {
			return code;
		}

		public String getMessage() {
			return message;
		}
	}

	private final Kind kind;
	private final SilFile.Item offendingNode;

	public ErrorReason(Kind kind, SilFile.Item offendingNode) {
		this.kind = kind;
		this.offendingNode = offendingNode;
	}

	public Kind getKind() {
		return kind;
	}

	public SilFile.Item getOffendingNode() {
		return offendingNode;
	}

	public String getMessage() {
		String text = SilFilePrinter.toString(offendingNode);
		return kind.getMessage() + " (" + text + ")";
	}

	@Override
	public String toString() {
		return kind.name() + "(" + SilFilePrinter.toString(offendingNode) + ")";
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static ErrorReason receiverNull(SilFile.Item node) {
		return new ErrorReason(Kind.RECEIVER_NULL, node);
	}

	public static ErrorReason negativePermission(SilFile.Item node) {
		return new ErrorReason(Kind.NEGATIVE_PERMISSION, node);
	}

	public static ErrorReason assertionFalse(SilFile.Item node) {
		return new ErrorReason(Kind.ASSERTION_FALSE, node);
	}

	public static ErrorReason namedMagicWandChunkNotFound(SilFile.Item node) {
		return new ErrorReason(Kind.NAMED_MAGIC_WAND_CHUNK_NOT_FOUND, node);
	}

	public static ErrorReason insufficientPermission(SilFile.Item node) {
		return new ErrorReason(Kind.INSUFFICIENT_PERMISSION, node);
	}

	public static ErrorReason magicWandChunkNotFound(SilFile.Item node) {
		return new ErrorReason(Kind.MAGIC_WAND_CHUNK_NOT_FOUND, node);
	}

	public static ErrorReason divisionByZero(SilFile.Item node) {
		return new ErrorReason(Kind.DIVISION_BY_ZERO, node);
	}
}
