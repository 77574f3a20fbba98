/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.hmmrecognizer.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class CmdArgsTest {

    @Test
    public void testRead() {
        CmdArgs args = CmdArgs.read(new String[]{"model.hmm", "--algorithm=viterbi", "-Format=json", "a.obs"});

        assertEquals("viterbi", args.get("algorithm", ""));
        assertEquals("json", args.get("format", ""));
        assertEquals(Arrays.asList("model.hmm", "a.obs"), args.getPositional());
    }

    @Test
    public void testDuplicateKeyFails() {
        assertThrows(IllegalArgumentException.class,
                () -> CmdArgs.read(new String[]{"algorithm=forward", "algorithm=viterbi"}));
    }

    @Test
    public void testMergeConfigFile(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("recognize.properties");
        Files.write(config, Arrays.asList("# comment", "model.tolerance=0.01", "algorithm=backward", "broken line"),
                StandardCharsets.UTF_8);

        CmdArgs args = CmdArgs.readFromConfigAndMerge(CmdArgs.read(new String[]{
                "config=" + config.toString(), "algorithm=forward", "x.hmm"}));

        assertEquals(0.01, args.getDouble("model.tolerance", 0), 1e-10);
        // explicit arguments win
        assertEquals("forward", args.get("algorithm", ""));
        assertEquals(Arrays.asList("x.hmm"), args.getPositional());
    }

    @Test
    public void testMissingConfigFile(@TempDir Path dir) {
        CmdArgs args = CmdArgs.read(new String[]{"config=" + dir.resolve("missing.properties")});
        assertThrows(IOException.class, () -> CmdArgs.readFromConfigAndMerge(args));
    }
}
