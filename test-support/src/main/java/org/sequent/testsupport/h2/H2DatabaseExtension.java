/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sequent.testsupport.h2;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Creates a new, empty, in-memory H2 database in PostgreSQL mode before each test and drops it after the test.
 * <pre>
 * &#064;RegisterExtension
 * H2DatabaseExtension database = new H2DatabaseExtension();
 * </pre>
 */
public class H2DatabaseExtension implements BeforeEachCallback, AfterEachCallback {

    private DataSource dataSource;

    @Override
    public void beforeEach(ExtensionContext extensionContext) {
        dataSource = createDataSource();
    }

    @Override
    public void afterEach(ExtensionContext extensionContext) {
        new JdbcTemplate(dataSource).execute("SHUTDOWN");
        dataSource = null;
    }

    public DataSource getDataSource() {
        return requireNonNull(dataSource, "The database is only available while a test is running");
    }

    public JdbcTemplate jdbcTemplate() {
        return new JdbcTemplate(getDataSource());
    }

    public static DataSource createDataSource() {
        String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
        return new DriverManagerDataSource(url, "sa", "");
    }
}
