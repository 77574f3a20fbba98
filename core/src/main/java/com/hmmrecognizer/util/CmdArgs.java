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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Stores command line options in a map. The capitalization of the key is ignored. Arguments
 * without a '=' are kept as positional arguments, e.g. the model and observation files.
 *
 * @author Peter Karich
 */
public class CmdArgs extends PMap {
    public static final String SYSTEM_PROPERTY_PREFIX = "hmm.";

    private final List<String> positional;

    public CmdArgs() {
        this(new LinkedHashMap<String, String>(), new ArrayList<String>());
    }

    private CmdArgs(Map<String, String> map, List<String> positional) {
        super(map);
        this.positional = positional;
    }

    private static CmdArgs argsFromPropertiesFile(String configLocation) throws IOException {
        Map<String, String> map = new LinkedHashMap<>();
        try (Reader reader = Helper.createReader(configLocation)) {
            Helper.loadProperties(map, reader);
        }
        CmdArgs cmdArgs = new CmdArgs();
        cmdArgs.merge(map);
        return cmdArgs;
    }

    private static CmdArgs argsFromSystemProperties() {
        CmdArgs cmdArgs = new CmdArgs();
        for (Entry<Object, Object> e : System.getProperties().entrySet()) {
            String k = ((String) e.getKey());
            String v = ((String) e.getValue());
            if (k.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                k = k.substring(SYSTEM_PROPERTY_PREFIX.length());
                cmdArgs.put(k, v);
            }
        }
        return cmdArgs;
    }

    /**
     * This method creates a CmdArgs object from the specified string array. Arguments of the form
     * key=value become options, all other arguments are positional.
     */
    public static CmdArgs read(String[] args) {
        Map<String, String> map = new LinkedHashMap<>();
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            int index = arg.indexOf("=");
            if (index <= 0) {
                positional.add(arg);
                continue;
            }

            String key = arg.substring(0, index);
            if (key.startsWith("-")) {
                key = key.substring(1);
            }

            if (key.startsWith("-")) {
                key = key.substring(1);
            }

            String value = arg.substring(index + 1);
            String old = map.put(key.toLowerCase(), value);
            if (old != null)
                throw new IllegalArgumentException("Pair '" + key.toLowerCase() + "'='" + value + "' not possible to " +
                        "add to the CmdArgs-object as the key already exists with '" + old + "'");
        }

        return new CmdArgs(map, positional);
    }

    /**
     * Merges system properties prefixed with 'hmm.' and, if the 'config' option is set, the
     * referenced properties file. Explicit arguments win over the properties file.
     */
    public static CmdArgs readFromConfigAndMerge(CmdArgs args) throws IOException {
        args.merge(argsFromSystemProperties());

        String propertiesFile = args.get("config", "");
        if (!Helper.isEmpty(propertiesFile)) {
            CmdArgs argsFromPropertiesFile = argsFromPropertiesFile(propertiesFile);
            argsFromPropertiesFile.merge(args);
            argsFromPropertiesFile.positional.addAll(args.positional);
            return argsFromPropertiesFile;
        }
        return args;
    }

    public List<String> getPositional() {
        return positional;
    }

    @Override
    public CmdArgs put(String key, Object str) {
        super.put(key, str);
        return this;
    }
}
