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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Options controlling the symbolic executor and its collaborators.
 */
public class Config {
	private static final Logger logger = LogManager.getLogger(Config.class);

	/**
	 * The classpath resource from which options are loaded by default.
	 */
	public static final String RESOURCE = "wysilicon.properties";

	public static final String DISABLE_SUBSUMPTION = "wysilicon.disableSubsumption";
	public static final String LOG_STATES = "wysilicon.logStates";
	public static final String PROVER_TIMEOUT = "wysilicon.proverTimeout";

	private boolean disableSubsumption = false;
	private boolean logStates = false;
	private int proverTimeout = 10000;

	/**
	 * When subsumption is disabled, checking an assertion does not contribute
	 * anything it learns to the path conditions of the code following it.
	 *
	 * @param flag
	 * @return
	 */
	public Config setDisableSubsumption(boolean flag) {
		this.disableSubsumption = flag;
		return this;
	}

	public boolean isDisableSubsumption() {
		return disableSubsumption;
	}

	/**
	 * Log the full symbolic state before every statement is executed.
	 *
	 * @param flag
	 * @return
	 */
	public Config setLogStates(boolean flag) {
		this.logStates = flag;
		return this;
	}

	public boolean isLogStates() {
		return logStates;
	}

	/**
	 * Limit the time (in milliseconds) the solver may spend on a single query,
	 * after which the query is treated as unproven. Zero means no limit.
	 *
	 * @param timeout
	 * @return
	 */
	public Config setProverTimeout(int timeout) {
		if (timeout < 0) {
			throw new IllegalArgumentException("invalid prover timeout (" + timeout + ")");
		}
		this.proverTimeout = timeout;
		return this;
	}

	public int getProverTimeout() {
		return proverTimeout;
	}

	/**
	 * Construct a configuration from a set of properties. Properties which are
	 * absent retain their default values.
	 *
	 * @param properties
	 * @return
	 */
	public static Config fromProperties(Properties properties) {
		Config config = new Config();
		String subsumption = properties.getProperty(DISABLE_SUBSUMPTION);
		String states = properties.getProperty(LOG_STATES);
		String timeout = properties.getProperty(PROVER_TIMEOUT);
		if (subsumption != null) {
			config.setDisableSubsumption(Boolean.parseBoolean(subsumption.trim()));
		}
		if (states != null) {
			config.setLogStates(Boolean.parseBoolean(states.trim()));
		}
		if (timeout != null) {
			try {
				config.setProverTimeout(Integer.parseInt(timeout.trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("invalid value for " + PROVER_TIMEOUT + " (" + timeout + ")", e);
			}
		}
		return config;
	}

	/**
	 * Load the configuration from the default classpath resource, or use the
	 * defaults if there is no such resource.
	 *
	 * @return
	 */
	public static Config load() {
		try (InputStream in = Config.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in == null) {
				logger.debug("no {} found, using defaults", RESOURCE);
				return new Config();
			}
			Properties properties = new Properties();
			properties.load(in);
			return fromProperties(properties);
		} catch (IOException e) {
			throw new IllegalStateException("failed loading " + RESOURCE, e);
		}
	}

	@Override
	public String toString() {
		return "{disableSubsumption=" + disableSubsumption + ", logStates=" + logStates
				+ ", proverTimeout=" + proverTimeout + "}";
	}
}
