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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.dynamo.kiln.CookExceptionError;
import com.dynamo.kiln.IProgress;
import com.dynamo.kiln.NullProgress;
import com.dynamo.kiln.OperationResult;
import com.dynamo.kiln.Project;
import com.dynamo.kiln.TaskResult;
import com.dynamo.kiln.fs.ProjectPath;
import com.dynamo.kiln.spec.DataSpecEntry;
import com.dynamo.kiln.spec.DataSpecRegistry;
import com.dynamo.kiln.test.util.MockDataSpec;
import com.dynamo.kiln.test.util.MockObject;
import com.dynamo.kiln.test.util.ProjectTestUtil;
import com.dynamo.kiln.tool.IToolBridge;
import com.dynamo.kiln.tool.ToolConnection;
import com.dynamo.kiln.tool.ToolSession;
import com.dynamo.kiln.util.FileUtil;

public class CookTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private DataSpecRegistry registry;
    private Project project;

    @Before
    public void setUp() throws Exception {
        registry = new DataSpecRegistry();
    }

    private void createProject(DataSpecEntry... entries) throws Exception {
        List<String> names = new ArrayList<String>();
        for (DataSpecEntry entry : entries) {
            registry.register(entry);
            names.add(entry.getName());
        }
        project = ProjectTestUtil.createProject(tmp.newFolder("project"), registry);
        assertTrue(project.enableDataSpecs(names));
    }

    private ProjectPath path(String p) {
        return project.getProjectWorkingPath().resolve(p);
    }

    private ProjectPath write(String p, String content) throws Exception {
        return ProjectTestUtil.writeFile(project, p, content);
    }

    private OperationResult cook(String p, boolean force, int pass) {
        return project.cookPath(path(p), new NullProgress(), true, force, false, null, null, pass);
    }

    @Test
    public void testCookSingleFile() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 1);
        createProject(entry);
        write("models/foo.mesh", "vertices\n");
        assertTrue(project.addPaths(Arrays.asList(path("models/foo.mesh"))));

        OperationResult result = project.cookPath(path("models/foo.mesh"), new NullProgress(), false, false, false, null, null, 0);
        assertTrue(result.isOk());
        assertEquals(1, result.count(TaskResult.Result.SUCCESS));

        ProjectPath cookedRoot = project.getProjectCookedPath(entry);
        assertEquals(Arrays.asList("models/foo.mesh"), ProjectTestUtil.listFiles(cookedRoot));
        assertEquals("MOCK LITTLE\nvertices\n", ProjectTestUtil.readFile(cookedRoot.resolve("models/foo.mesh")));
    }

    @Test
    public void testEndiannessOption() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 1);
        createProject(entry);
        write("models/foo.mesh", "vertices\n");
        project.setOption("endianness", "big");
        assertTrue(cook("models", false, -1).isOk());
        assertEquals("MOCK BIG\nvertices\n", ProjectTestUtil.readFile(project.getProjectCookedPath(entry).resolve("models/foo.mesh")));
    }

    @Test
    public void testFingerprintSkip() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 1);
        createProject(entry);
        write("models/foo.mesh", "vertices\n");
        assertTrue(cook("models", false, -1).isOk());

        File cooked = project.getProjectCookedPath(entry).resolve("models/foo.mesh").toFile();
        long past = 1000000000000L;
        assertTrue(cooked.setLastModified(past));

        OperationResult result = cook("models", false, -1);
        assertTrue(result.isOk());
        assertEquals(1, result.count(TaskResult.Result.SKIPPED));
        assertEquals(past, cooked.lastModified());

        // a new project instance reads the persisted cook state
        Project reopened = new Project(project.getProjectRootPath(), registry);
        reopened.registerObjectType("mesh", MockObject::new);
        result = reopened.cookPath(path("models"), new NullProgress(), true, false, false, null, null, -1);
        assertEquals(1, result.count(TaskResult.Result.SKIPPED));
        assertEquals(past, cooked.lastModified());

        // forced
        result = cook("models", true, -1);
        assertEquals(1, result.count(TaskResult.Result.SUCCESS));
        assertNotEquals(past, cooked.lastModified());

        // changed source
        assertTrue(cooked.setLastModified(past));
        write("models/foo.mesh", "other vertices\n");
        result = cook("models", false, -1);
        assertEquals(1, result.count(TaskResult.Result.SUCCESS));
        assertThat(ProjectTestUtil.readFile(project.getProjectCookedPath(entry).resolve("models/foo.mesh")), containsString("other vertices"));

        // missing output
        assertTrue(cooked.delete());
        result = cook("models", false, -1);
        assertEquals(1, result.count(TaskResult.Result.SUCCESS));
        assertTrue(cooked.isFile());
    }

    @Test
    public void testPassResolvesReferences() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 2);
        createProject(entry);
        write("models/a.mesh", "ref models/b.mesh\n");
        write("models/b.mesh", "payload\n");
        ProjectPath cookedA = project.getProjectCookedPath(entry).resolve("models/a.mesh");

        assertTrue(cook("models", false, 0).isOk());
        assertThat(ProjectTestUtil.readFile(cookedA), containsString(MockObject.PLACEHOLDER));

        OperationResult result = cook("models", false, 1);
        assertTrue(result.isOk());
        assertEquals(2, result.count(TaskResult.Result.SUCCESS));
        long id = project.getObject(path("models/b.mesh")).getId();
        assertEquals(path("models/b.mesh"), project.lookupBridgePath(id));
        String cooked = ProjectTestUtil.readFile(cookedA);
        assertThat(cooked, not(containsString(MockObject.PLACEHOLDER)));
        assertThat(cooked, containsString(String.format("ref %016x", id)));
    }

    @Test
    public void testCookAllPasses() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 2);
        createProject(entry);
        write("models/a.mesh", "ref models/b.mesh\n");
        write("models/b.mesh", "payload\n");
        assertTrue(project.cookAllPasses(path("models"), new NullProgress(), true, false, false, null).isOk());
        String cooked = ProjectTestUtil.readFile(project.getProjectCookedPath(entry).resolve("models/a.mesh"));
        assertThat(cooked, not(containsString(MockObject.PLACEHOLDER)));
    }

    @Test
    public void testRunStoppedBeforeLastPassIsRecooked() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 2);
        createProject(entry);
        write("models/a.mesh", "ref models/b.mesh\n");
        write("models/b.mesh", "payload\n");
        ProjectPath cookedA = project.getProjectCookedPath(entry).resolve("models/a.mesh");

        assertTrue(cook("models", false, 0).isOk());
        project.interruptCook();
        assertTrue(cook("models", false, 1).isInterrupted());
        assertThat(ProjectTestUtil.readFile(cookedA), containsString(MockObject.PLACEHOLDER));

        OperationResult result = project.cookAllPasses(path("models"), new NullProgress(), true, false, false, null);
        assertTrue(result.isOk());
        assertEquals(0, result.count(TaskResult.Result.SKIPPED));
        String cooked = ProjectTestUtil.readFile(cookedA);
        assertThat(cooked, not(containsString(MockObject.PLACEHOLDER)));
        assertThat(cooked, containsString(String.format("ref %016x", project.getObject(path("models/b.mesh")).getId())));

        // a completed run is up to date
        result = project.cookAllPasses(path("models"), new NullProgress(), true, false, false, null);
        assertTrue(result.isOk());
        assertEquals(0, result.count(TaskResult.Result.SUCCESS));
        assertEquals(cooked, ProjectTestUtil.readFile(cookedA));
    }

    @Test
    public void testNewRunClearsBridgeCache() throws Exception {
        createProject(MockDataSpec.createEntry("Mock", 1));
        write("models/b.mesh", "payload\n");
        assertTrue(cook("models", false, 0).isOk());
        long id = project.getObject(path("models/b.mesh")).getId();
        assertEquals(path("models/b.mesh"), project.lookupBridgePath(id));
        write("other/c.mesh", "payload\n");
        assertTrue(cook("other", false, 0).isOk());
        assertNull(project.lookupBridgePath(id));
    }

    @Test
    public void testInterrupt() throws Exception {
        DataSpecEntry entry = new DataSpecEntry("Mock", "", ".mpak", 1, (e, p, t) -> new MockDataSpec(e, p, t) {
            @Override
            public void doCook(ProjectPath path, ProjectPath cookedPath, boolean fast, IProgress progress) throws CookExceptionError, IOException {
                super.doCook(path, cookedPath, fast, progress);
                if (path.getName().equals("b.mesh")) {
                    project.interruptCook();
                }
            }
        });
        createProject(entry);
        write("models/a.mesh", "a\n");
        write("models/b.mesh", "b\n");
        write("models/c.mesh", "c\n");
        ProjectPath cookedRoot = project.getProjectCookedPath(entry);

        OperationResult result = cook("models", false, 0);
        assertTrue(result.isInterrupted());
        assertFalse(result.isOk());
        assertEquals("MOCK LITTLE\na\n", ProjectTestUtil.readFile(cookedRoot.resolve("models/a.mesh")));
        assertFalse(cookedRoot.resolve("models/b.mesh").exists());
        assertFalse(cookedRoot.resolve("models/c.mesh").exists());
        assertEquals(Arrays.asList("models/a.mesh"), ProjectTestUtil.listFiles(cookedRoot));

        // later passes of the interrupted run don't cook
        assertTrue(cook("models", false, 1).isInterrupted());

        // a new run starts over, a is up to date
        result = project.cookPath(path("models/c.mesh"), new NullProgress(), false, false, false, null, null, 0);
        assertTrue(result.isOk());
        assertTrue(cookedRoot.resolve("models/c.mesh").isFile());
    }

    @Test
    public void testInterruptForwardedToDataSpec() throws Exception {
        List<MockDataSpec> created = new ArrayList<MockDataSpec>();
        DataSpecEntry entry = new DataSpecEntry("Mock", "", ".mpak", 1, (e, p, t) -> {
            MockDataSpec spec = new MockDataSpec(e, p, t) {
                @Override
                public void doCook(ProjectPath path, ProjectPath cookedPath, boolean fast, IProgress progress) throws CookExceptionError, IOException {
                    project.interruptCook();
                    super.doCook(path, cookedPath, fast, progress);
                }
            };
            created.add(spec);
            return spec;
        });
        createProject(entry);
        write("models/a.mesh", "a\n");

        OperationResult result = cook("models", false, 0);
        assertTrue(result.isInterrupted());
        assertEquals(1, created.size());
        assertTrue(created.get(0).isInterruptRequested());
        assertFalse(project.getProjectCookedPath(entry).resolve("models/a.mesh").exists());
    }

    @Test
    public void testFailure() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 1);
        createProject(entry);
        write("models/a.mesh", "a\n");
        write("models/b.mesh", "b\n");
        ProjectPath cookedA = project.getProjectCookedPath(entry).resolve("models/a.mesh");
        assertTrue(cook("models", false, -1).isOk());
        assertTrue(cookedA.isFile());

        write("models/a.mesh", "fail\n");
        OperationResult result = cook("models", true, -1);
        assertEquals(OperationResult.Result.FAILED, result.getResult());
        assertEquals(1, result.count(TaskResult.Result.FAILED));
        assertEquals(1, result.count(TaskResult.Result.SUCCESS));
        assertFalse(cookedA.exists());
    }

    @Test
    public void testFailFast() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 1);
        createProject(entry);
        write("models/a.mesh", "fail\n");
        write("models/b.mesh", "b\n");
        project.setOption("fail-fast", "true");

        OperationResult result = cook("models", false, -1);
        assertEquals(OperationResult.Result.FAILED, result.getResult());
        assertEquals(1, result.getTaskResults().size());
        assertFalse(project.getProjectCookedPath(entry).resolve("models/b.mesh").exists());
    }

    @Test
    public void testOverrideDataSpec() throws Exception {
        DataSpecEntry secondary = MockDataSpec.createEntry("Secondary", 1);
        DataSpecEntry primary = new DataSpecEntry("Primary", "", ".mpak", 1, (e, p, t) -> new MockDataSpec(e, p, t) {
            @Override
            public DataSpecEntry overrideDataSpec(ProjectPath path, DataSpecEntry oldEntry) {
                return path.getExtension().equals("tex") ? secondary : oldEntry;
            }
        });
        registry.register(secondary);
        createProject(primary);
        write("models/a.mesh", "a\n");
        write("models/b.tex", "b\n");

        OperationResult result = cook("models", false, -1);
        assertTrue(result.isOk());
        assertEquals(Arrays.asList("models/a.mesh"), ProjectTestUtil.listFiles(project.getProjectCookedPath(primary)));
        assertEquals(Arrays.asList("models/b.tex"), ProjectTestUtil.listFiles(project.getProjectCookedPath(secondary)));
    }

    @Test
    public void testMultipleDataSpecs() throws Exception {
        DataSpecEntry first = MockDataSpec.createEntry("First", 1);
        DataSpecEntry second = MockDataSpec.createEntry("Second", 1);
        createProject(first, second);
        write("models/a.mesh", "a\n");
        write("models/readme.txt", "not cooked\n");

        OperationResult result = cook("", false, -1);
        assertTrue(result.isOk());
        assertEquals(2, result.getTaskResults().size());
        assertEquals(Arrays.asList("models/a.mesh"), ProjectTestUtil.listFiles(project.getProjectCookedPath(first)));
        assertEquals(Arrays.asList("models/a.mesh"), ProjectTestUtil.listFiles(project.getProjectCookedPath(second)));

        // only the selected data spec
        result = project.cookPath(path(""), new NullProgress(), true, true, false, second, null, -1);
        assertEquals(1, result.getTaskResults().size());
        assertEquals("Second", result.getTaskResults().get(0).getDataSpec());
    }

    @Test
    public void testWorkers() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 1);
        createProject(entry);
        List<String> expected = new ArrayList<String>();
        for (int i = 0; i < 20; ++i) {
            String p = String.format("models/m%02d.mesh", i);
            write(p, "mesh " + i + "\n");
            expected.add(p);
        }
        ExecutorService workers = Executors.newFixedThreadPool(4);
        try {
            OperationResult result = project.cookPath(path("models"), new NullProgress(), true, false, false, null, workers, -1);
            assertTrue(result.isOk());
            assertEquals(20, result.count(TaskResult.Result.SUCCESS));
        } finally {
            workers.shutdown();
        }
        assertEquals(expected, ProjectTestUtil.listFiles(project.getProjectCookedPath(entry)));
    }

    @Test
    public void testCleanPath() throws Exception {
        DataSpecEntry entry = MockDataSpec.createEntry("Mock", 1);
        createProject(entry);
        write("models/a.mesh", "a\n");
        write("models/sub/b.mesh", "b\n");
        assertTrue(project.addPaths(Arrays.asList(path("models"))));
        assertTrue(cook("models", false, -1).isOk());
        ProjectPath cookedRoot = project.getProjectCookedPath(entry);

        assertTrue(project.cleanPath(path("models"), false));
        assertEquals(Arrays.asList("models/sub/b.mesh"), ProjectTestUtil.listFiles(cookedRoot));
        assertTrue(project.cleanPath(path("models"), true));
        assertEquals(new ArrayList<String>(), ProjectTestUtil.listFiles(cookedRoot));

        // tracking is unchanged and the next cook isn't skipped
        assertEquals(2, project.getTrackedPaths().size());
        assertEquals(2, cook("models", false, -1).count(TaskResult.Result.SUCCESS));
    }

    @Test
    public void testRemoveUntrackedPath() throws Exception {
        DataSpecEntry first = MockDataSpec.createEntry("Mock", 1);
        DataSpecEntry second = MockDataSpec.createEntry("Other", 1);
        createProject(first, second);
        write("models/foo.mesh", "foo\n");
        write("models/sub/bar.mesh", "bar\n");
        assertTrue(cook("models", false, -1).isOk());
        assertTrue(project.getTrackedPaths().isEmpty());

        assertTrue(project.removePaths(Arrays.asList(path("models/foo.mesh")), false));
        for (DataSpecEntry entry : Arrays.asList(first, second)) {
            assertEquals(Arrays.asList("models/sub/bar.mesh"), ProjectTestUtil.listFiles(project.getProjectCookedPath(entry)));
        }

        assertTrue(project.removePaths(Arrays.asList(path("models")), true));
        for (DataSpecEntry entry : Arrays.asList(first, second)) {
            assertEquals(new ArrayList<String>(), ProjectTestUtil.listFiles(project.getProjectCookedPath(entry)));
        }

        // nothing is skipped on the next cook
        assertEquals(4, cook("models", false, -1).count(TaskResult.Result.SUCCESS));
    }

    @Test
    public void testCookWithToolBridge() throws Exception {
        List<String> requests = new ArrayList<String>();
        IToolBridge bridge = new IToolBridge() {
            @Override
            public byte[] cookToBuffer(File sourcePath, String expectedType, String platform, boolean bigEndian) throws IOException {
                requests.add(sourcePath.getName() + " " + expectedType + " " + bigEndian);
                return "tool output".getBytes(StandardCharsets.UTF_8);
            }

            @Override
            public boolean runScript(String script) throws IOException {
                return true;
            }

            @Override
            public boolean open(File path) throws IOException {
                return true;
            }

            @Override
            public boolean create(File path) throws IOException {
                return true;
            }

            @Override
            public void shutdown() {
            }
        };
        DataSpecEntry entry = new DataSpecEntry("Tool", "", ".mpak", 1, (e, p, t) -> new MockDataSpec(e, p, t) {
            @Override
            public void doCook(ProjectPath path, ProjectPath cookedPath, boolean fast, IProgress progress) throws CookExceptionError, IOException {
                try (ToolSession session = project.getToolConnection().openSession()) {
                    FileUtil.writeAtomic(cookedPath.toFile(), session.cookToBuffer(path.toFile(), "MESH", "generic", false));
                }
            }
        });
        createProject(entry);
        project.setToolConnection(new ToolConnection(bridge));
        write("models/a.mesh", "a\n");

        assertTrue(cook("models", false, -1).isOk());
        assertEquals(Arrays.asList("a.mesh MESH false"), requests);
        assertEquals("tool output", ProjectTestUtil.readFile(project.getProjectCookedPath(entry).resolve("models/a.mesh")));
        assertFalse(project.getToolConnection().isBusy());
    }

    @Test
    public void testNoDataSpecs() throws Exception {
        project = ProjectTestUtil.createProject(tmp.newFolder("project"), registry);
        write("models/a.mesh", "a\n");
        assertFalse(cook("models", false, -1).isOk());
        assertFalse(cook("missing", false, -1).isOk());
    }
}
