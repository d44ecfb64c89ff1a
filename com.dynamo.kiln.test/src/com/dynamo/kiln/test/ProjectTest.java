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

package com.dynamo.kiln.test;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.dynamo.kiln.ConfigException;
import com.dynamo.kiln.NullProgress;
import com.dynamo.kiln.OperationResult;
import com.dynamo.kiln.Project;
import com.dynamo.kiln.fs.ProjectPath;
import com.dynamo.kiln.fs.ProjectRootPath;
import com.dynamo.kiln.object.ObjectBase;
import com.dynamo.kiln.spec.DataSpecEntry;
import com.dynamo.kiln.spec.DataSpecRegistry;
import com.dynamo.kiln.spec.ProjectDataSpec;
import com.dynamo.kiln.test.util.MockDataSpec;
import com.dynamo.kiln.test.util.MockObject;
import com.dynamo.kiln.test.util.ProjectTestUtil;

public class ProjectTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private DataSpecRegistry registry;
    private DataSpecEntry mock;
    private DataSpecEntry other;
    private Project project;

    @Before
    public void setUp() throws Exception {
        registry = new DataSpecRegistry();
        mock = MockDataSpec.createEntry("Mock", 1);
        other = MockDataSpec.createEntry("Other", 1);
        registry.register(mock);
        registry.register(other);
        project = ProjectTestUtil.createProject(tmp.newFolder("project"), registry);
        assertEquals(Project.Status.VALID, project.getStatus());
    }

    private ProjectPath path(String p) {
        return project.getProjectWorkingPath().resolve(p);
    }

    private ProjectPath write(String p, String content) throws Exception {
        return ProjectTestUtil.writeFile(project, p, content);
    }

    private List<String> tracked() throws Exception {
        List<String> result = new ArrayList<String>();
        for (ProjectPath p : project.getTrackedPaths().keySet()) {
            result.add(p.getRelativePath());
        }
        Collections.sort(result);
        return result;
    }

    private File store(String name) {
        return new File(project.getProjectRootPath().toFile(), ProjectRootPath.DOT_DIR + "/" + name);
    }

    @Test
    public void testAddPathsIdempotent() throws Exception {
        write("models/foo.mesh", "foo\n");
        assertTrue(project.addPaths(Arrays.asList(path("models/foo.mesh"))));
        String once = FileUtils.readFileToString(store(Project.PATHS_STORE), StandardCharsets.UTF_8);
        assertTrue(project.addPaths(Arrays.asList(path("models/foo.mesh"))));
        String twice = FileUtils.readFileToString(store(Project.PATHS_STORE), StandardCharsets.UTF_8);
        assertEquals(once, twice);
        assertEquals(Arrays.asList("models/foo.mesh"), tracked());
        assertEquals("models/foo.mesh " + DigestUtils.sha1Hex("foo\n") + "\n", once);
    }

    @Test
    public void testAddPathsRefreshesFingerprint() throws Exception {
        write("models/foo.mesh", "foo\n");
        assertTrue(project.addPaths(Arrays.asList(path("models/foo.mesh"))));
        write("models/foo.mesh", "bar\n");
        assertTrue(project.addPaths(Arrays.asList(path("models/foo.mesh"))));
        Map<ProjectPath, String> paths = project.getTrackedPaths();
        assertEquals(1, paths.size());
        assertEquals(DigestUtils.sha1Hex("bar\n"), paths.get(path("models/foo.mesh")));
    }

    @Test
    public void testAddDirectoryAndWildcard() throws Exception {
        write("models/a.mesh", "a");
        write("models/sub/b.mesh", "b");
        write("models/c.tex", "c");
        write("models/.hidden", "h");
        write("common/d.tex", "d");

        assertTrue(project.addPaths(Arrays.asList(path("models/*.mesh"))));
        assertEquals(Arrays.asList("models/a.mesh"), tracked());

        assertTrue(project.addPaths(Arrays.asList(path("**/*.tex"))));
        assertEquals(Arrays.asList("common/d.tex", "models/a.mesh", "models/c.tex"), tracked());

        assertTrue(project.addPaths(Arrays.asList(path("models"))));
        assertEquals(Arrays.asList("common/d.tex", "models/a.mesh", "models/c.tex", "models/sub/b.mesh"), tracked());
    }

    @Test
    public void testAddMissingIsAllOrNothing() throws Exception {
        write("models/a.mesh", "a");
        assertFalse(project.addPaths(Arrays.asList(path("models/a.mesh"), path("models/missing.mesh"))));
        assertFalse(project.addPaths(Arrays.asList(path("models/a.mesh"), path("models/*.nothing"))));
        assertEquals(Collections.emptyList(), tracked());
    }

    @Test
    public void testRemovePaths() throws Exception {
        write("models/a.mesh", "a");
        write("models/sub/b.mesh", "b");
        write("common/c.tex", "c");
        assertTrue(project.addPaths(Arrays.asList(path(""))));
        assertTrue(project.enableDataSpecs(Arrays.asList("Mock")));
        assertTrue(project.cookPath(path(""), new NullProgress(), true, false, false, null, null, -1).isOk());
        ProjectPath cookedA = project.getProjectCookedPath(mock).resolve("models/a.mesh");
        ProjectPath cookedB = project.getProjectCookedPath(mock).resolve("models/sub/b.mesh");
        assertTrue(cookedA.isFile());

        // non-recursive only removes direct children
        assertTrue(project.removePaths(Arrays.asList(path("models")), false));
        assertEquals(Arrays.asList("common/c.tex", "models/sub/b.mesh"), tracked());
        assertFalse(cookedA.isFile());
        assertTrue(cookedB.isFile());

        assertTrue(project.removePaths(Arrays.asList(path("models")), true));
        assertEquals(Arrays.asList("common/c.tex"), tracked());
        assertFalse(cookedB.isFile());

        // working files are untouched
        assertTrue(path("models/a.mesh").isFile());
        assertTrue(path("models/sub/b.mesh").isFile());
    }

    @Test
    public void testGroups() throws Exception {
        FileUtils.forceMkdir(path("levels/level1/sub").toFile());
        FileUtils.forceMkdir(path("levels/level2").toFile());

        assertTrue(project.addGroup(path("levels/level1")));
        assertFalse(project.addGroup(path("levels/level1/sub")));
        assertEquals(Arrays.asList(path("levels/level1")), project.getGroups());

        assertFalse(project.addGroup(path("levels")));
        assertTrue(project.addGroup(path("levels/level1")));
        assertTrue(project.addGroup(path("levels/level2")));
        assertEquals(Arrays.asList(path("levels/level1"), path("levels/level2")), project.getGroups());

        assertFalse(project.addGroup(path("levels/missing")));
        assertFalse(project.addGroup(path("")));

        assertFalse(project.removeGroup(path("levels")));
        assertTrue(project.removeGroup(path("levels/level1")));
        assertEquals(Arrays.asList(path("levels/level2")), project.getGroups());
        assertTrue(project.addGroup(path("levels/level1/sub")));
    }

    private List<String> active() {
        List<String> result = new ArrayList<String>();
        for (ProjectDataSpec spec : project.getDataSpecs()) {
            if (spec.isActive()) {
                result.add(spec.getSpec().getName());
            }
        }
        return result;
    }

    @Test
    public void testEnableDisable() throws Exception {
        assertEquals(2, project.getDataSpecs().size());
        assertEquals(Collections.emptyList(), active());

        assertFalse(project.enableDataSpecs(Arrays.asList("Mock", "Unknown")));
        assertEquals(Collections.emptyList(), active());
        assertFalse(store(Project.SPECS_STORE).exists());

        assertTrue(project.enableDataSpecs(Arrays.asList("Other", "Mock")));
        // registration order, not enable order
        assertEquals(Arrays.asList("Mock", "Other"), active());

        assertFalse(project.disableDataSpecs(Arrays.asList("Other", "Unknown")));
        assertEquals(Arrays.asList("Mock", "Other"), active());
        assertTrue(project.disableDataSpecs(Arrays.asList("Other")));
        assertEquals(Arrays.asList("Mock"), active());
        assertEquals(project.getProjectCookedPath(mock), project.getDataSpecs().get(0).getCookedPath());
    }

    @Test
    public void testRescan() throws Exception {
        FileUtils.writeStringToFile(store(Project.SPECS_STORE), "Other\nUnknown\n", StandardCharsets.UTF_8);
        assertEquals(Collections.emptyList(), active());
        project.rescanDataSpecs();
        project.rescanDataSpecs();
        assertEquals(Arrays.asList("Other"), active());

        Project reopened = new Project(project.getProjectRootPath(), registry);
        assertEquals(Arrays.asList("Other"), reopenedActive(reopened));
    }

    private static List<String> reopenedActive(Project p) {
        List<String> result = new ArrayList<String>();
        for (ProjectDataSpec spec : p.getDataSpecs()) {
            if (spec.isActive()) {
                result.add(spec.getSpec().getName());
            }
        }
        return result;
    }

    @Test
    public void testInvalidProject() throws Exception {
        File missing = new File(tmp.getRoot(), "missing");
        Project invalid = new Project(new ProjectRootPath(missing), registry);
        assertEquals(Project.Status.INVALID, invalid.getStatus());
        assertFalse(invalid.isValid());
        assertFalse(invalid.addPaths(Arrays.asList(invalid.getProjectWorkingPath().resolve("a.mesh"))));
        assertFalse(invalid.enableDataSpecs(Arrays.asList("Mock")));
        OperationResult result = invalid.cookPath(invalid.getProjectWorkingPath(), new NullProgress());
        assertFalse(result.isOk());
        assertThat(result.getException(), instanceOf(ConfigException.class));
        assertFalse(missing.exists());
    }

    @Test
    public void testObjects() throws Exception {
        write("models/a.mesh", "a");
        write("models/b.txt", "b");
        ObjectBase a = project.getObject(path("models/a.mesh"));
        assertThat(a, instanceOf(MockObject.class));
        assertEquals(a, project.getObject(path("models/a.mesh")));
        ObjectBase b = project.getObject(path("models/b.txt"));
        assertEquals("NULL", b.getType().toString());
        assertTrue(a.getId() != b.getId());
        assertEquals(a.getId(), new MockObject(project, path("models/a.mesh")).getId());
    }

    @Test
    public void testOptions() throws Exception {
        assertFalse(project.hasOption("endianness"));
        assertEquals(ObjectBase.DataEndianness.NONE, project.getEndianness());
        project.setOption("endianness", "big");
        assertEquals("big", project.option("endianness", "little"));
        assertEquals(ObjectBase.DataEndianness.BIG, project.getEndianness());
    }

    @Test
    public void testPackageOutputPath() throws Exception {
        FileUtils.forceMkdir(path("models").toFile());
        assertEquals(path("out/Mock/models.mpak"), project.getPackageOutputPath(path("models"), mock));
        assertEquals(path("out/Mock/models/foo.mpak"), project.getPackageOutputPath(path("models/foo.mesh"), mock));
        assertEquals(path("out/Mock/project.mpak"), project.getPackageOutputPath(path(""), mock));
    }
}
