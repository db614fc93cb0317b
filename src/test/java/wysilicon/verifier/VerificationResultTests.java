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

import static org.junit.jupiter.api.Assertions.*;
import static wysilicon.core.SilFile.*;

import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import wysilicon.core.SilFile.Stmt;

public class VerificationResultTests {
	private static final Stmt.Assert STMT = ASSERT(CONST(false));

	private static VerificationResult.Failure failure() {
		return VerificationResult
				.failure(VerificationError.of(VerificationError.Kind.ASSERT_FAILED, STMT).dueTo(ErrorReason.assertionFalse(STMT.getCondition())));
	}

	@Test
	public void test_01() {
		AtomicBoolean called = new AtomicBoolean();
		VerificationResult r = failure().and(() -> {
			called.set(true);
			return VerificationResult.SUCCESS;
		});
		assertTrue(r.isFatal());
		assertFalse(called.get());
	}

	@Test
	public void test_02() {
		VerificationResult.Failure f = failure();
		assertSame(f, VerificationResult.SUCCESS.and(() -> f));
		assertFalse(VerificationResult.SUCCESS.isFatal());
	}

	@Test
	public void test_03() {
		VerificationError error = failure().getError();
		assertEquals(VerificationError.Kind.ASSERT_FAILED, error.getKind());
		assertEquals(ErrorReason.Kind.ASSERTION_FALSE, error.getReason().getKind());
		assertSame(STMT, error.getOffendingNode());
		assertEquals(6007, error.getKind().getCode());
	}
}
