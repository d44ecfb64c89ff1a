// Copyright 2020-2025 The Defold Foundation
// Licensed under the Defold License version 1.0 (the "License"); you may not use
// this file except in compliance with the License.
//
// You may obtain a copy of the License, together with FAQs at
// https://www.defold.com/license
//
// Unless required by applicable law or agreed to in writing, software distributed
// under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
// CONDITIONS OF ANY KIND, either express or implied. See the License for the
// specific language governing permissions and limitations under the License.

package com.dynamo.kiln;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Finds data spec providers in directories and jars on a class path.
 * Nested and anonymous classes are left out.
 */
public class ClassLoaderScanner implements IClassScanner {

    private final List<URL> extraUrls = new ArrayList<>();
    private final ClassLoader baseClassLoader;
    private URLClassLoader classLoader;

    public ClassLoaderScanner() {
        this(ClassLoaderScanner.class.getClassLoader());
    }

    public ClassLoaderScanner(ClassLoader loader) {
        baseClassLoader = loader;
    }

    private static void scanDir(File dir, String packageName, Set<String> classes) {
        File[] files = dir.listFiles();
        if (files == null) {
            return;
        }
        for (File file : files) {
            String name = file.getName();
            if (file.isDirectory()) {
                scanDir(file, packageName + "." + name, classes);
            } else if (name.endsWith(".class") && name.indexOf('$') == -1) {
                classes.add(packageName + "." + name.substring(0, name.length() - ".class".length()));
            }
        }
    }

    private static void scanJar(URL resource, String pkg, Set<String> classes) throws IOException {
        String relPath = pkg.replace('.', '/') + "/";
        String jarPath = resource.getPath().replaceFirst("[.]jar[!].*", ".jar").replaceFirst("file:", "");
        try (JarFile jarFile = new JarFile(URLDecoder.decode(jarPath, StandardCharsets.UTF_8.name()))) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                String entryName = entries.nextElement().getName();
                if (entryName.startsWith(relPath) && entryName.endsWith(".class") && entryName.indexOf('$') == -1) {
                    classes.add(entryName.substring(0, entryName.length() - ".class".length()).replace('/', '.'));
                }
            }
        }
    }

    // Last added url takes precedence
    @Override
    public synchronized void addUrl(File file) {
        try {
            extraUrls.add(0, file.toURI().toURL());
            classLoader = null;
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(String.format("Couldn't add '%s' to the class path", file), e);
        }
    }

    @Override
    public synchronized ClassLoader getClassLoader() {
        if (extraUrls.isEmpty()) {
            return baseClassLoader;
        }
        if (classLoader == null) {
            classLoader = new URLClassLoader(extraUrls.toArray(new URL[0]), baseClassLoader);
        }
        return classLoader;
    }

    public static Set<String> scanClassLoader(ClassLoader classLoader, String pkg) {
        Set<String> classes = new TreeSet<String>();
        try {
            Enumeration<URL> e = classLoader.getResources(pkg.replace('.', '/'));
            while (e.hasMoreElements()) {
                URL url = e.nextElement();
                String protocol = url.getProtocol();
                if (protocol.equals("file")) {
                    scanDir(new File(URLDecoder.decode(url.getFile(), StandardCharsets.UTF_8.name())), pkg, classes);
                } else if (protocol.equals("jar")) {
                    scanJar(url, pkg, classes);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException(String.format("Unable to scan package '%s'", pkg), e);
        }
        return classes;
    }

    @Override
    public Set<String> scan(String pkg) {
        return scanClassLoader(getClassLoader(), pkg);
    }
}
