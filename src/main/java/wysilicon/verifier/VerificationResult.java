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

import java.util.function.Supplier;

/**
 * The outcome of verifying some fragment of a program, which is either
 * {@link Success} or a {@link Failure} carrying the first error encountered.
 */
public abstract class VerificationResult {
	public static final Success SUCCESS = new Success();

	/**
	 * Check whether this result is a failure.
	 *
	 * @return
	 */
	public abstract boolean isFatal();

	/**
	 * Combine this result with another. The other result is only computed when
	 * this is not a failure, in which case it determines the overall outcome.
	 * Otherwise, this failure is returned unchanged.
	 *
	 * @param other
	 * @return
	 */
	public VerificationResult and(Supplier<VerificationResult> other) {
		if (isFatal()) {
			return this;
		} else {
			return other.get();
		}
	}

	public static Failure failure(VerificationError error) {
		return new Failure(error);
	}

	public static final class Success extends VerificationResult {
		private Success() {
		}

		@Override
		public boolean isFatal() {
			return false;
		}

		@Override
		public String toString() {
			return "Success";
		}
	}

	public static final class Failure extends VerificationResult {
		private final VerificationError error;

		private Failure(VerificationError error) {
			if (error == null) {
				throw new IllegalArgumentException("failure requires an error");
			}
			this.error = error;
		}

		public VerificationError getError() {
			return error;
		}

		@Override
		public boolean isFatal() {
			return true;
		}

		@Override
		public String toString() {
			return "Failure(" + error.getMessage() + ")";
		}
	}
}
