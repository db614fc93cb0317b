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

import static org.junit.jupiter.api.Assertions.fail;

import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import wysilicon.tasks.SilVerifyTask;
import wysilicon.verifier.VerificationResult;

public class ValidTests {

	// ======================================================================
	// Test Harness
	// ======================================================================

	@ParameterizedTest
	@MethodSource("data")
	protected void test(String name) {
		try (SilVerifyTask task = new SilVerifyTask(TestPrograms.VALID.get(name))) {
			for (Map.Entry<String, VerificationResult> e : task.verifyAll().entrySet()) {
				if (e.getValue().isFatal()) {
					fail("Test should have verified! (" + e.getKey() + ": " + e.getValue() + ")");
				}
			}
		}
	}

	// ======================================================================
	// Data sources
	// ======================================================================

	private static Stream<String> data() {
		return TestPrograms.VALID.keySet().stream();
	}
}
