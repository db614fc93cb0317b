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

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class ConfigTests {

	@Test
	public void test_defaults_01() {
		Config config = new Config();
		assertFalse(config.isDisableSubsumption());
		assertFalse(config.isLogStates());
		assertEquals(10000, config.getProverTimeout());
	}

	@Test
	public void test_load_01() {
		Config config = Config.load();
		assertFalse(config.isDisableSubsumption());
		assertEquals(10000, config.getProverTimeout());
	}

	@Test
	public void test_properties_01() {
		Properties properties = new Properties();
		properties.setProperty(Config.DISABLE_SUBSUMPTION, "true");
		properties.setProperty(Config.PROVER_TIMEOUT, " 250 ");
		Config config = Config.fromProperties(properties);
		assertTrue(config.isDisableSubsumption());
		assertFalse(config.isLogStates());
		assertEquals(250, config.getProverTimeout());
	}

	@Test
	public void test_properties_02() {
		Properties properties = new Properties();
		properties.setProperty(Config.PROVER_TIMEOUT, "many");
		assertThrows(IllegalArgumentException.class, () -> Config.fromProperties(properties));
		properties.setProperty(Config.PROVER_TIMEOUT, "-1");
		assertThrows(IllegalArgumentException.class, () -> Config.fromProperties(properties));
	}
}
