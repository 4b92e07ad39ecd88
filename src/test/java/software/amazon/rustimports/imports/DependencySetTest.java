/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import java.util.Set;
import org.junit.jupiter.api.Test;

public class DependencySetTest {
    @Test
    public void normalizesHyphens() {
        DependencySet dependencies = DependencySet.of("serde-json", "tokio");

        assertThat(dependencies.dependencies(), containsInAnyOrder("serde_json", "tokio"));
        assertThat(dependencies.contains("serde_json"), is(true));
        assertThat(dependencies.contains("serde-json"), is(true));
    }

    @Test
    public void containsChecksAllKinds() {
        DependencySet dependencies = new DependencySet(Set.of("a"), Set.of("b-c"), Set.of("d"));

        assertThat(dependencies.contains("a"), is(true));
        assertThat(dependencies.contains("b_c"), is(true));
        assertThat(dependencies.contains("d"), is(true));
        assertThat(dependencies.contains("e"), is(false));
    }

    @Test
    public void emptySet() {
        assertThat(DependencySet.EMPTY.isEmpty(), is(true));
        assertThat(new DependencySet(null, null, null), equalTo(DependencySet.EMPTY));
        assertThat(DependencySet.of("a").isEmpty(), is(false));
    }
}
