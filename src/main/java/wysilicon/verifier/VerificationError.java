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

/**
 * A verification error, made up of the construct which could not be verified
 * and the reason why. For example, a field write may fail because its receiver
 * might be null.
 *
 * @author David J. Pearce
 *
 */
public final class VerificationError {

	public enum Kind {
		ASSIGNMENT_FAILED(6000, "Assignment might fail"),
		IF_FAILED(6001, "Conditional statement might fail"),
		LOOP_INVARIANT_NOT_PRESERVED(6002, "Loop invariant might not be preserved"),
		LOOP_INVARIANT_NOT_ESTABLISHED(6003, "Loop invariant might not hold on entry"),
		WHILE_FAILED(6004, "While statement might fail"),
		INHALE_FAILED(6005, "Inhale might fail"),
		EXHALE_FAILED(6006, "Exhale might fail"),
		ASSERT_FAILED(6007, "Assert might fail"),
		PRECONDITION_IN_CALL_FALSE(6008, "The precondition of method might not hold"),
		FOLD_FAILED(6009, "Folding might fail"),
		UNFOLD_FAILED(6010, "Unfolding might fail"),
		PACKAGE_FAILED(6011, "Package statement might fail"),
		APPLY_FAILED(6012, "Apply might fail"),
		LET_WAND_FAILED(6013, "Binding of magic wand might fail"),
		POSTCONDITION_VIOLATED(6014, "Postcondition might not hold"),
		CONTRACT_NOT_WELLFORMED(6015, "Contract might not be well-formed");

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

	/**
	 * A verification error which is still missing its reason. The executor
	 * creates one of these for each construct it verifies, and collaborators
	 * complete it once they know what went wrong.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Partial {
		public VerificationError dueTo(ErrorReason reason);
	}

	private final Kind kind;
	private final SilFile.Item offendingNode;
	private final ErrorReason reason;

	public VerificationError(Kind kind, SilFile.Item offendingNode, ErrorReason reason) {
		this.kind = kind;
		this.offendingNode = offendingNode;
		this.reason = reason;
	}

	public Kind getKind() {
		return kind;
	}

	public int getCode() {
		return kind.getCode();
	}

	public SilFile.Item getOffendingNode() {
		return offendingNode;
	}

	public ErrorReason getReason() {
		return reason;
	}

	/**
	 * Get the position of the offending construct, or <code>null</code> if none
	 * was attached.
	 *
	 * @return
	 */
	public SilFile.Position getPosition() {
		return offendingNode == null ? null : offendingNode.getAttribute(SilFile.Position.class);
	}

	public String getMessage() {
		SilFile.Position pos = getPosition();
		String msg = kind.getMessage();
		if (pos != null) {
			msg += " at " + pos;
		}
		return msg + ". " + reason.getMessage();
	}

	@Override
	public String toString() {
		return getMessage();
	}

	public static Partial of(Kind kind, SilFile.Item node) {
		return reason -> new VerificationError(kind, node, reason);
	}
}
