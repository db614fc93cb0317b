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
package wysilicon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import wysilicon.tasks.SilVerifyTask;
import wysilicon.verifier.VerificationError;
import wysilicon.verifier.VerificationResult;

public class InvalidTests {

	// ======================================================================
	// Test Harness
	// ======================================================================

	@ParameterizedTest
	@MethodSource("data")
	protected void test(String name) {
		TestPrograms.Invalid testcase = TestPrograms.INVALID.get(name);
		VerificationResult r;
		try (SilVerifyTask task = new SilVerifyTask(testcase.getProgram())) {
			r = task.verifyAll().get("test");
		}
		assertTrue(r.isFatal(), "Test should have failed to verify!");
		// Check the error is the expected one
		VerificationError error = ((VerificationResult.Failure) r).getError();
		assertEquals(testcase.getKind(), error.getKind());
		assertEquals(testcase.getReason(), error.getReason().getKind());
	}

	// ======================================================================
	// Data sources
	// ======================================================================

	private static Stream<String> data() {
		return TestPrograms.INVALID.keySet().stream();
	}
}
