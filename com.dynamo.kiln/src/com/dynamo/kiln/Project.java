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
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import com.dynamo.kiln.bridge.BridgePathCache;
import com.dynamo.kiln.config.ConfigFile;
import com.dynamo.kiln.config.CookState;
import com.dynamo.kiln.depsgraph.DepsgraphBuilder;
import com.dynamo.kiln.depsgraph.PackageDepsgraph;
import com.dynamo.kiln.fs.PathWalker;
import com.dynamo.kiln.fs.ProjectPath;
import com.dynamo.kiln.fs.ProjectRootPath;
import com.dynamo.kiln.image.IImageWriter;
import com.dynamo.kiln.logging.Logger;
import com.dynamo.kiln.object.IObjectFactory;
import com.dynamo.kiln.object.ObjectBase;
import com.dynamo.kiln.object.ObjectBase.DataEndianness;
import com.dynamo.kiln.spec.DataSpecEntry;
import com.dynamo.kiln.spec.DataSpecRegistry;
import com.dynamo.kiln.spec.DataSpecTool;
import com.dynamo.kiln.spec.ExtractPassInfo;
import com.dynamo.kiln.spec.ExtractReport;
import com.dynamo.kiln.spec.IDataSpec;
import com.dynamo.kiln.spec.ProjectDataSpec;
import com.dynamo.kiln.tool.ToolConnection;
import com.dynamo.kiln.util.FileUtil;
import com.dynamo.kiln.util.PathUtil;

/**
 * Project abstraction. Tracks working paths, dependency groups and enabled
 * data specs, and drives cooking and packaging.
 *
 * A project is long-lived. Cook and package operations block the calling
 * thread; they may dispatch objects to a worker pool but always wait for it.
 */
public class Project {

    private static Logger logger = Logger.getLogger(Project.class.getName());

    public static final String SPECS_STORE = "specs";
    public static final String PATHS_STORE = "paths";
    public static final String GROUPS_STORE = "groups";
    public static final String COOKED_DIR = "cooked";
    public static final String OUTPUT_DIR = "out";

    public enum Status {
        UNINITIALIZED,
        VALID,
        COOKING,
        PACKAGING,
        INVALID
    }

    private final ProjectRootPath rootPath;
    private final DataSpecRegistry registry;
    private final ProjectPath workRoot;
    private final ProjectPath dotPath;
    private final ProjectPath cookedRoot;
    private final ProjectPath outputRoot;

    private final ConfigFile specs;
    private final ConfigFile paths;
    private final ConfigFile groups;

    private volatile Status status = Status.UNINITIALIZED;
    private volatile List<ProjectDataSpec> compiledSpecs = Collections.emptyList();

    private final Map<DataSpecEntry, IDataSpec> cookSpecs = new HashMap<DataSpecEntry, IDataSpec>();
    private final Map<DataSpecEntry, CookState> cookStates = new HashMap<DataSpecEntry, CookState>();
    private final Set<String> cookedThisRun = ConcurrentHashMap.newKeySet();
    private final BridgePathCache bridgePathCache = new BridgePathCache();
    private final Map<String, IObjectFactory> extToFactory = new HashMap<String, IObjectFactory>();
    private final Map<ProjectPath, ObjectBase> objects = new ConcurrentHashMap<ProjectPath, ObjectBase>();
    private final Map<String, String> options = new HashMap<String, String>();
    private volatile ToolConnection toolConnection;

    private volatile boolean cookInterrupted;
    private volatile IDataSpec[] interruptTargets = new IDataSpec[0];

    public Project(ProjectRootPath rootPath) {
        this(rootPath, DataSpecRegistry.getGlobal());
    }

    public Project(ProjectRootPath rootPath, DataSpecRegistry registry) {
        this.rootPath = rootPath;
        this.registry = registry;
        this.workRoot = rootPath.getRootPath();
        this.dotPath = workRoot.resolve(ProjectRootPath.DOT_DIR);
        this.cookedRoot = dotPath.resolve(COOKED_DIR);
        this.outputRoot = workRoot.resolve(OUTPUT_DIR);
        this.specs = new ConfigFile(rootPath, SPECS_STORE);
        this.paths = new ConfigFile(rootPath, PATHS_STORE);
        this.groups = new ConfigFile(rootPath, GROUPS_STORE);

        if (!rootPath.isDirectory()) {
            logger.severe("Project root '%s' is not a directory", rootPath);
            status = Status.INVALID;
            return;
        }
        try {
            FileUtils.forceMkdir(cookedRoot.toFile());
            rescanDataSpecs();
            status = Status.VALID;
        } catch (IOException | ConfigException e) {
            logger.log(Level.SEVERE, String.format("Unable to open project '%s'", rootPath), e);
            status = Status.INVALID;
        }
    }

    public Status getStatus() {
        return status;
    }

    public boolean isValid() {
        return status != Status.INVALID && status != Status.UNINITIALIZED;
    }

    private ConfigException invalidProject() {
        return new ConfigException(String.format("Project '%s' is invalid", rootPath));
    }

    public ProjectRootPath getProjectRootPath() {
        return rootPath;
    }

    public ProjectPath getProjectWorkingPath() {
        return workRoot;
    }

    public ProjectPath getProjectCookedPath() {
        return cookedRoot;
    }

    /**
     * Get the cooked root of a data spec
     * @param entry data spec entry
     * @return cooked root, mirrors the working tree
     */
    public ProjectPath getProjectCookedPath(DataSpecEntry entry) {
        return cookedRoot.resolve(entry.getName());
    }

    /**
     * Get the package file written by {@link #packagePath} for a path
     * @param path working path the package is rooted at
     * @param entry data spec that packages
     * @return output path below out/
     */
    public ProjectPath getPackageOutputPath(ProjectPath path, DataSpecEntry entry) {
        String name;
        if (path.isRoot()) {
            name = rootPath.toFile().getName();
        } else if (path.isDirectory()) {
            name = path.getRelativePath();
        } else {
            name = FilenameUtils.removeExtension(path.getRelativePath());
        }
        return outputRoot.resolve(entry.getName()).resolve(name + entry.getPackageExt());
    }

    public DataSpecRegistry getRegistry() {
        return registry;
    }

    /**
     * Set option
     * @param key option key
     * @param value option value
     */
    public void setOption(String key, String value) {
        synchronized (options) {
            options.put(key, value);
        }
    }

    /**
     * Get option
     * @param key key to get option for
     * @param defaultValue default value
     * @return mapped value or default value is key doesn't exists
     */
    public String option(String key, String defaultValue) {
        synchronized (options) {
            String v = options.get(key);
            return v != null ? v : defaultValue;
        }
    }

    public boolean hasOption(String key) {
        synchronized (options) {
            return options.containsKey(key);
        }
    }

    public Map<String, String> getOptions() {
        synchronized (options) {
            return new HashMap<String, String>(options);
        }
    }

    /**
     * Get the byte order requested with the "endianness" option
     * @return BIG, LITTLE or NONE if not set
     */
    public DataEndianness getEndianness() {
        String e = option("endianness", "");
        if (e.equalsIgnoreCase("big")) {
            return DataEndianness.BIG;
        } else if (e.equalsIgnoreCase("little")) {
            return DataEndianness.LITTLE;
        }
        return DataEndianness.NONE;
    }

    public ToolConnection getToolConnection() {
        return toolConnection;
    }

    public void setToolConnection(ToolConnection toolConnection) {
        this.toolConnection = toolConnection;
    }

    // Objects

    /**
     * Register a factory for objects with a specific file extension
     * @param ext extension, with or without leading dot
     * @param factory object factory
     */
    public void registerObjectType(String ext, IObjectFactory factory) {
        String key = ext.startsWith(".") ? ext.substring(1) : ext;
        synchronized (extToFactory) {
            extToFactory.put(key, factory);
        }
        objects.clear();
    }

    /**
     * Get the object of a working path. Objects are created on first use and
     * shared until the next cook run or depsgraph build.
     * @param path working path
     * @return object
     */
    public ObjectBase getObject(ProjectPath path) {
        ObjectBase object = objects.get(path);
        if (object == null) {
            IObjectFactory factory;
            synchronized (extToFactory) {
                factory = extToFactory.get(path.getExtension());
            }
            ObjectBase created = factory != null ? factory.create(this, path) : new ObjectBase(path);
            object = objects.putIfAbsent(path, created);
            if (object == null) {
                object = created;
            }
        }
        return object;
    }

    // Config stores

    @FunctionalInterface
    private interface ConfigTransaction {
        /**
         * @return true to commit, false to discard
         */
        boolean apply(ConfigFile file);
    }

    private static boolean transact(ConfigFile file, ConfigTransaction transaction) throws ConfigException {
        file.lockAndRead();
        boolean commit;
        try {
            commit = transaction.apply(file);
        } catch (RuntimeException e) {
            file.unlockAndDiscard();
            throw e;
        }
        if (commit) {
            file.unlockAndCommit();
        } else {
            file.unlockAndDiscard();
        }
        return commit;
    }

    private static List<String> read(ConfigFile file) throws ConfigException {
        List<String> lines = file.lockAndRead();
        file.unlockAndDiscard();
        return lines;
    }

    private static String linePath(String line) {
        int i = line.lastIndexOf(' ');
        return i == -1 ? line : line.substring(0, i);
    }

    private static String lineFingerprint(String line) {
        int i = line.lastIndexOf(' ');
        return i == -1 ? "" : line.substring(i + 1);
    }

    private static boolean matches(ProjectPath path, ProjectPath target, boolean recursive) {
        if (path.equals(target)) {
            return true;
        }
        return recursive ? path.isUnder(target) : target.equals(path.getParent());
    }

    private class WorkingTreeWalker extends PathWalker.FileWalker {
        @Override
        public boolean handleDirectory(ProjectPath path, Collection<ProjectPath> results) {
            return super.handleDirectory(path, results) && !path.equals(outputRoot);
        }

        @Override
        public void handleFile(ProjectPath path, Collection<ProjectPath> results) {
            if (!path.isUnder(dotPath) && !path.isUnder(outputRoot)) {
                super.handleFile(path, results);
            }
        }
    }

    /**
     * Get tracked paths
     * @return map of tracked path to the fingerprint recorded when it was added
     * @throws ConfigException
     */
    public Map<ProjectPath, String> getTrackedPaths() throws ConfigException {
        if (!isValid()) {
            throw invalidProject();
        }
        Map<ProjectPath, String> result = new LinkedHashMap<ProjectPath, String>();
        for (String line : read(paths)) {
            result.put(workRoot.resolve(linePath(line)), lineFingerprint(line));
        }
        return result;
    }

    public boolean addPaths(Collection<ProjectPath> paths) {
        return addPaths(paths, new NullProgress());
    }

    /**
     * Add working paths to the project. Directories add every file below
     * them and paths with wildcards add the matching files. Re-adding a path
     * updates its fingerprint. Nothing is added if any input is missing.
     * @param paths files, directories or wildcard patterns
     * @param progress progress sink
     * @return true on success
     */
    public boolean addPaths(Collection<ProjectPath> paths, IProgress progress) {
        if (!isValid()) {
            logger.severe("Unable to add paths, project '%s' is invalid", rootPath);
            return false;
        }
        Set<ProjectPath> files = new LinkedHashSet<ProjectPath>();
        for (ProjectPath p : paths) {
            String rel = p.getRelativePath();
            if (PathUtil.isWildcard(rel)) {
                List<ProjectPath> found = new ArrayList<ProjectPath>();
                PathWalker.walk(workRoot.resolve(PathUtil.wildcardBase(rel)), true, new WorkingTreeWalker(), found);
                Pattern pattern = PathUtil.compileWildcard(rel);
                int before = files.size();
                for (ProjectPath f : found) {
                    if (pattern.matcher(f.getRelativePath()).matches()) {
                        files.add(f);
                    }
                }
                if (files.size() == before) {
                    logger.severe("No files match '%s'", p);
                    return false;
                }
            } else if (p.isFile()) {
                files.add(p);
            } else if (p.isDirectory()) {
                PathWalker.walk(p, true, new WorkingTreeWalker(), files);
            } else {
                logger.severe("'%s' does not exist", p);
                return false;
            }
        }

        Map<String, String> lines = new LinkedHashMap<String, String>();
        progress.beginTask(IProgress.Task.ADDING, files.size());
        try {
            for (ProjectPath f : files) {
                lines.put(f.getRelativePath(), FileUtil.fingerprint(f.toFile()));
                progress.worked(f.getRelativePath(), 1);
            }
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Unable to fingerprint files", e);
            return false;
        } finally {
            progress.done();
        }

        try {
            transact(this.paths, file -> {
                for (Map.Entry<String, String> e : lines.entrySet()) {
                    String rel = e.getKey();
                    String line = rel + " " + e.getValue();
                    file.removeLines(l -> linePath(l).equals(rel) && !l.equals(line));
                    file.addLine(line);
                }
                return true;
            });
        } catch (ConfigException e) {
            logger.log(Level.SEVERE, e.getMessage(), e);
            return false;
        }
        logger.fine("Added %d paths", lines.size());
        return true;
    }

    /**
     * Stop tracking paths and delete their cooked outputs. Working files are
     * left untouched.
     * @param paths files or directories, tracked or not
     * @param recursive remove everything below directories instead of only direct children
     * @return true on success
     */
    public boolean removePaths(Collection<ProjectPath> paths, boolean recursive) {
        if (!isValid()) {
            logger.severe("Unable to remove paths, project '%s' is invalid", rootPath);
            return false;
        }
        try {
            transact(this.paths, file -> {
                for (String line : file.getLines()) {
                    ProjectPath tracked = workRoot.resolve(linePath(line));
                    for (ProjectPath p : paths) {
                        if (matches(tracked, p, recursive)) {
                            file.removeLine(line);
                            break;
                        }
                    }
                }
                return true;
            });
        } catch (ConfigException e) {
            logger.log(Level.SEVERE, e.getMessage(), e);
            return false;
        }

        // Cooked output exists for untracked paths too
        boolean ok = true;
        for (ProjectPath p : paths) {
            ok &= cleanPath(p, recursive);
        }
        return ok;
    }

    /**
     * Get registered dependency groups
     * @return group directories
     * @throws ConfigException
     */
    public List<ProjectPath> getGroups() throws ConfigException {
        if (!isValid()) {
            throw invalidProject();
        }
        List<ProjectPath> result = new ArrayList<ProjectPath>();
        for (String line : read(groups)) {
            result.add(workRoot.resolve(line));
        }
        return result;
    }

    /**
     * Register a directory as a dependency group. Groups don't nest: a
     * directory inside a group, or one that contains a group, is rejected.
     * @param path working directory
     * @return true if the directory is a group after the call
     */
    public boolean addGroup(ProjectPath path) {
        if (!isValid()) {
            logger.severe("Unable to add group, project '%s' is invalid", rootPath);
            return false;
        }
        if (path.isRoot() || !path.isDirectory() || path.isUnder(dotPath) || path.isUnder(outputRoot)) {
            logger.severe("'%s' is not a working directory", path);
            return false;
        }
        try {
            return transact(groups, file -> {
                for (String line : file.getLines()) {
                    ProjectPath group = workRoot.resolve(line);
                    if (!group.equals(path) && (path.isUnder(group) || group.isUnder(path))) {
                        logger.severe("'%s' overlaps group '%s'", path, group);
                        return false;
                    }
                }
                file.addLine(path.getRelativePath());
                return true;
            });
        } catch (ConfigException e) {
            logger.log(Level.SEVERE, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Unregister a dependency group
     * @param path group directory
     * @return false if the directory isn't a group
     */
    public boolean removeGroup(ProjectPath path) {
        if (!isValid()) {
            logger.severe("Unable to remove group, project '%s' is invalid", rootPath);
            return false;
        }
        try {
            return transact(groups, file -> {
                if (!file.checkForLine(path.getRelativePath())) {
                    logger.warning("'%s' is not a group", path);
                    return false;
                }
                file.removeLine(path.getRelativePath());
                return true;
            });
        } catch (ConfigException e) {
            logger.log(Level.SEVERE, e.getMessage(), e);
            return false;
        }
    }

    // Data specs

    /**
     * Re-read the enabled data specs. Picks up external edits of the specs store.
     * @throws ConfigException if the store can't be read
     */
    public void rescanDataSpecs() throws ConfigException {
        Set<String> enabled = new HashSet<String>(read(specs));
        List<ProjectDataSpec> result = new ArrayList<ProjectDataSpec>();
        for (DataSpecEntry entry : registry.getEntries()) {
            result.add(new ProjectDataSpec(entry, getProjectCookedPath(entry), enabled.contains(entry.getName())));
            enabled.remove(entry.getName());
        }
        for (String name : enabled) {
            logger.warning("Enabled data spec '%s' is not registered", name);
        }
        compiledSpecs = Collections.unmodifiableList(result);
    }

    /**
     * Get all registered data specs with their activation state, in registration order
     * @return data specs
     */
    public List<ProjectDataSpec> getDataSpecs() {
        return compiledSpecs;
    }

    private List<ProjectDataSpec> getActiveDataSpecs() {
        List<ProjectDataSpec> result = new ArrayList<ProjectDataSpec>();
        for (ProjectDataSpec spec : compiledSpecs) {
            if (spec.isActive()) {
                result.add(spec);
            }
        }
        return result;
    }

    private ProjectDataSpec findDataSpec(DataSpecEntry entry) {
        for (ProjectDataSpec spec : compiledSpecs) {
            if (spec.getSpec() == entry) {
                return spec;
            }
        }
        return null;
    }

    public boolean enableDataSpecs(Collection<String> names) {
        return updateDataSpecs(names, true);
    }

    public boolean disableDataSpecs(Collection<String> names) {
        return updateDataSpecs(names, false);
    }

    private boolean updateDataSpecs(Collection<String> names, boolean enable) {
        if (!isValid()) {
            logger.severe("Unable to change data specs, project '%s' is invalid", rootPath);
            return false;
        }
        for (String name : names) {
            if (registry.find(name) == null) {
                logger.severe("Unknown data spec '%s'", name);
                return false;
            }
        }
        try {
            transact(specs, file -> {
                for (String name : names) {
                    if (enable) {
                        file.addLine(name);
                    } else {
                        file.removeLine(name);
                    }
                }
                return true;
            });
            rescanDataSpecs();
        } catch (ConfigException e) {
            logger.log(Level.SEVERE, e.getMessage(), e);
            return false;
        }
        return true;
    }

    private IDataSpec getCookSpec(DataSpecEntry entry) {
        synchronized (cookSpecs) {
            return cookSpecs.computeIfAbsent(entry, e -> e.create(this, DataSpecTool.COOK));
        }
    }

    // Cook state

    private File getCookStateFile(DataSpecEntry entry) {
        return dotPath.resolve(entry.getName() + CookState.EXTENSION).toFile();
    }

    private CookState getCookState(DataSpecEntry entry) {
        synchronized (cookStates) {
            return cookStates.computeIfAbsent(entry, e -> CookState.load(getCookStateFile(e)));
        }
    }

    private boolean saveCookState(DataSpecEntry entry) {
        CookState state;
        synchronized (cookStates) {
            state = cookStates.get(entry);
        }
        if (state == null) {
            return true;
        }
        try {
            state.save(getCookStateFile(entry));
            return true;
        } catch (IOException e) {
            logger.warning("Unable to save cook state of %s, objects will be recooked: %s", entry.getName(), e.getMessage());
            return false;
        }
    }

    private void saveCookStates() {
        List<DataSpecEntry> entries;
        synchronized (cookStates) {
            entries = new ArrayList<DataSpecEntry>(cookStates.keySet());
        }
        for (DataSpecEntry entry : entries) {
            saveCookState(entry);
        }
    }

    // Cooking

    public boolean isCookInterrupted() {
        return cookInterrupted;
    }

    /**
     * Request the running cook or package operation to stop. Safe to call
     * from any thread; doesn't block or allocate. The request holds until the
     * next cook run starts at pass 0 or the next package operation starts.
     */
    public void interruptCook() {
        cookInterrupted = true;
        IDataSpec[] targets = interruptTargets;
        for (int i = 0; i < targets.length; ++i) {
            targets[i].interruptCook();
        }
    }

    private void beginCookRun() {
        cookInterrupted = false;
        cookedThisRun.clear();
        objects.clear();
        clearBridgePathCache();
        synchronized (cookStates) {
            cookStates.clear();
        }
    }

    public OperationResult cookPath(ProjectPath path, IProgress progress) {
        return cookPath(path, progress, false, false, false, null, null, -1);
    }

    /**
     * Cook working files for one pass.
     *
     * A pass of 0 or less starts a new cook run, which resets the bridge
     * cache and any pending interrupt. Within a run an object cooked by an
     * earlier pass is cooked again when a later pass claims it; otherwise
     * objects whose source is unchanged since their last cook are skipped.
     * @param path working file or directory
     * @param progress progress sink
     * @param recursive cook files in sub-directories
     * @param force cook even if the source is unchanged
     * @param fast draft quality cooking
     * @param spec cook with this data spec only, null for all enabled
     * @param workers optional worker pool, may be null
     * @param cookPass pass index, negative to cook without pass gating
     * @return outcome with one task result per cooked or skipped object
     */
    public OperationResult cookPath(ProjectPath path, IProgress progress, boolean recursive, boolean force, boolean fast,
                                    DataSpecEntry spec, ExecutorService workers, int cookPass) {
        if (!isValid()) {
            return OperationResult.failed(invalidProject());
        }
        if (!path.exists()) {
            return OperationResult.failed(new KilnException(String.format("'%s' does not exist", path)));
        }
        if (cookPass <= 0) {
            beginCookRun();
        }

        List<ProjectDataSpec> targets;
        if (spec != null) {
            ProjectDataSpec target = findDataSpec(spec);
            if (target == null) {
                return OperationResult.failed(new KilnException(String.format("Data spec '%s' is not registered", spec.getName())));
            }
            targets = Collections.singletonList(target);
        } else {
            targets = getActiveDataSpecs();
        }
        if (targets.isEmpty()) {
            return OperationResult.failed(new KilnException("No data specs are enabled"));
        }

        OperationResult result = new OperationResult();
        if (cookInterrupted) {
            result.setResult(OperationResult.Result.INTERRUPTED);
            return result;
        }

        List<ProjectPath> objectPaths = new ArrayList<ProjectPath>();
        PathWalker.walk(path, recursive, new WorkingTreeWalker(), objectPaths);

        List<IDataSpec> instances = new ArrayList<IDataSpec>();
        for (ProjectDataSpec target : targets) {
            instances.add(getCookSpec(target.getSpec()));
        }

        boolean failFast = option("fail-fast", "false").equals("true");
        AtomicBoolean stop = new AtomicBoolean();
        boolean workerFailed = false;
        status = Status.COOKING;
        interruptTargets = instances.toArray(new IDataSpec[0]);
        progress.beginTask(IProgress.Task.COOKING, objectPaths.size());
        try {
            if (workers == null) {
                for (ProjectPath p : objectPaths) {
                    if (cookInterrupted || stop.get()) {
                        break;
                    }
                    cookObject(p, targets, force, fast, cookPass, progress, result, failFast, stop);
                    progress.worked(p.getRelativePath(), 1);
                }
            } else {
                IProgress sharedProgress = new MultiProgress(progress);
                List<Future<?>> futures = new ArrayList<Future<?>>();
                for (ProjectPath p : objectPaths) {
                    futures.add(workers.submit(() -> {
                        if (cookInterrupted || stop.get()) {
                            return;
                        }
                        cookObject(p, targets, force, fast, cookPass, sharedProgress, result, failFast, stop);
                        sharedProgress.worked(p.getRelativePath(), 1);
                    }));
                }
                for (Future<?> future : futures) {
                    try {
                        future.get();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        interruptCook();
                    } catch (ExecutionException e) {
                        logger.log(Level.SEVERE, "Cook worker failed", e.getCause());
                        workerFailed = true;
                    }
                }
            }
        } finally {
            interruptTargets = new IDataSpec[0];
            saveCookStates();
            status = Status.VALID;
            progress.done();
        }

        if (cookInterrupted) {
            result.setResult(OperationResult.Result.INTERRUPTED);
        } else if (workerFailed || result.count(TaskResult.Result.FAILED) > 0) {
            result.setResult(OperationResult.Result.FAILED);
        }
        return result;
    }

    /**
     * Run a complete cook: one {@link #cookPath} call per pass declared by
     * the enabled data specs. Stops at the first pass that doesn't succeed.
     * @return outcome of the last pass that ran
     */
    public OperationResult cookAllPasses(ProjectPath path, IProgress progress, boolean recursive, boolean force, boolean fast, ExecutorService workers) {
        int passes = 1;
        for (ProjectDataSpec spec : getActiveDataSpecs()) {
            passes = Math.max(passes, spec.getSpec().getNumCookPasses());
        }
        OperationResult result = null;
        for (int pass = 0; pass < passes; ++pass) {
            result = cookPath(path, progress, recursive, force, fast, null, workers, pass);
            if (!result.isOk()) {
                break;
            }
        }
        return result;
    }

    private void cookObject(ProjectPath path, List<ProjectDataSpec> targets, boolean force, boolean fast, int cookPass,
                            IProgress progress, OperationResult result, boolean failFast, AtomicBoolean stop) {
        Set<DataSpecEntry> claimed = new HashSet<DataSpecEntry>();
        String rel = path.getRelativePath();
        String fingerprint = null;
        for (ProjectDataSpec target : targets) {
            if (cookInterrupted) {
                return;
            }
            IDataSpec dataSpec = getCookSpec(target.getSpec());
            if (!dataSpec.canCook(path, cookPass)) {
                continue;
            }
            DataSpecEntry entry = dataSpec.overrideDataSpec(path, target.getSpec());
            if (entry == null || !claimed.add(entry)) {
                continue;
            }
            IDataSpec cookSpec = entry == target.getSpec() ? dataSpec : getCookSpec(entry);
            ProjectPath cookedPath = path.rebase(workRoot, getProjectCookedPath(entry));
            CookState state = getCookState(entry);
            String runKey = entry.getName() + ":" + rel;
            TaskResult taskResult = new TaskResult(path, entry.getName());
            try {
                if (fingerprint == null) {
                    fingerprint = FileUtil.fingerprint(path.toFile());
                }
                if (!force && !cookedThisRun.contains(runKey) && cookedPath.isFile() && fingerprint.equals(state.getFingerprint(rel))) {
                    taskResult.setResult(TaskResult.Result.SKIPPED);
                    taskResult.setMessage("Up to date");
                    addBridgePathToCache(getObject(path).getId(), path);
                } else {
                    state.removeFingerprint(rel);
                    cookSpec.doCook(path, cookedPath, fast, progress);
                    if (cookInterrupted) {
                        FileUtil.deleteIfExists(cookedPath.toFile());
                        taskResult.setResult(TaskResult.Result.FAILED);
                        taskResult.setMessage("Interrupted");
                    } else {
                        // Earlier passes may leave unresolved references behind
                        if (cookPass < 0 || cookPass >= entry.getNumCookPasses() - 1) {
                            state.putFingerprint(rel, fingerprint);
                        }
                        cookedThisRun.add(runKey);
                        addBridgePathToCache(getObject(path).getId(), path);
                        logger.fine("Cooked %s with %s", path, entry.getName());
                    }
                }
            } catch (CookExceptionError | IOException | RuntimeException e) {
                taskResult.setResult(TaskResult.Result.FAILED);
                taskResult.setMessage(e.getMessage());
                taskResult.setException(e);
                state.removeFingerprint(rel);
                try {
                    FileUtil.deleteIfExists(cookedPath.toFile());
                } catch (IOException deleteError) {
                    logger.warning("Unable to delete cooked output '%s': %s", cookedPath, deleteError.getMessage());
                }
                if (!cookInterrupted) {
                    logger.warning("Unable to cook '%s' with %s: %s", path, entry.getName(), e.getMessage());
                    if (failFast) {
                        stop.set(true);
                    }
                }
            }
            result.addTaskResult(taskResult);
        }
    }

    /**
     * Delete cooked outputs of all data specs. Tracked paths are left untouched.
     * @param path working file or directory
     * @param recursive delete below sub-directories too
     * @return true on success
     */
    public boolean cleanPath(ProjectPath path, boolean recursive) {
        if (!isValid()) {
            logger.severe("Unable to clean, project '%s' is invalid", rootPath);
            return false;
        }
        boolean ok = true;
        for (ProjectDataSpec spec : compiledSpecs) {
            File cooked = path.rebase(workRoot, spec.getCookedPath()).toFile();
            try {
                if (cooked.isDirectory()) {
                    if (recursive) {
                        FileUtils.deleteDirectory(cooked);
                    } else {
                        File[] files = cooked.listFiles(File::isFile);
                        if (files != null) {
                            for (File f : files) {
                                Files.delete(f.toPath());
                            }
                        }
                    }
                } else {
                    FileUtil.deleteIfExists(cooked);
                }
            } catch (IOException e) {
                logger.warning("Unable to clean '%s': %s", cooked, e.getMessage());
                ok = false;
            }
            getCookState(spec.getSpec()).removeFingerprints(p -> matches(workRoot.resolve(p), path, recursive));
            ok &= saveCookState(spec.getSpec());
        }
        return ok;
    }

    // Packaging

    /**
     * Build the dependency graph of a working path using the cooked tree of
     * the first enabled data spec
     * @param path working file or directory
     * @return depsgraph
     * @throws KilnException
     */
    public PackageDepsgraph buildPackageDepsgraph(ProjectPath path) throws KilnException {
        List<ProjectDataSpec> active = getActiveDataSpecs();
        return buildPackageDepsgraph(path, active.isEmpty() ? null : active.get(0).getSpec());
    }

    /**
     * Build the dependency graph of a working path. The bridge cache is
     * rebuilt from the objects in the graph.
     * @param path working file or directory, every file below a directory is a root
     * @param entry data spec providing cooked paths, may be null
     * @return depsgraph
     * @throws KilnException
     */
    public PackageDepsgraph buildPackageDepsgraph(ProjectPath path, DataSpecEntry entry) throws KilnException {
        if (!isValid()) {
            throw invalidProject();
        }
        if (!path.exists()) {
            throw new KilnException(String.format("'%s' does not exist", path));
        }
        objects.clear();
        clearBridgePathCache();

        ProjectPath specCookedRoot = entry != null ? getProjectCookedPath(entry) : null;
        DepsgraphBuilder builder = new DepsgraphBuilder(path, workRoot, specCookedRoot, getGroups());
        List<ProjectPath> roots = new ArrayList<ProjectPath>();
        PathWalker.walk(path, true, new WorkingTreeWalker(), roots);
        try {
            for (ProjectPath root : roots) {
                builder.add(getObject(root));
            }
        } catch (IOException e) {
            throw new KilnException(String.format("Unable to gather dependencies of '%s'", path), e);
        }
        PackageDepsgraph depsgraph = builder.build();
        for (PackageDepsgraph.Node node : depsgraph.getDataNodes()) {
            addBridgePathToCache(node.getObject().getId(), node.getPath());
        }
        return depsgraph;
    }

    public OperationResult packagePath(ProjectPath path, IProgress progress) {
        return packagePath(path, progress, false, null, null);
    }

    /**
     * Package cooked objects. The package file is only written if every
     * object in the depsgraph has a cooked output.
     * @param path working file or directory the package is rooted at
     * @param progress progress sink
     * @param fast draft quality packaging
     * @param spec package with this data spec, null for the first enabled one that can
     * @param workers optional worker pool, may be null
     * @return outcome, failed with a {@link MissingDependencyException} if cooked outputs are missing
     */
    public OperationResult packagePath(ProjectPath path, IProgress progress, boolean fast, DataSpecEntry spec, ExecutorService workers) {
        if (!isValid()) {
            return OperationResult.failed(invalidProject());
        }
        if (!path.exists()) {
            return OperationResult.failed(new KilnException(String.format("'%s' does not exist", path)));
        }
        cookInterrupted = false;

        IDataSpec packageSpec = null;
        DataSpecEntry entry = null;
        if (spec != null) {
            IDataSpec candidate = spec.create(this, DataSpecTool.PACKAGE);
            if (candidate.canPackage(path)) {
                packageSpec = candidate;
                entry = spec;
            }
        } else {
            for (ProjectDataSpec active : getActiveDataSpecs()) {
                IDataSpec candidate = active.getSpec().create(this, DataSpecTool.PACKAGE);
                if (candidate.canPackage(path)) {
                    packageSpec = candidate;
                    entry = active.getSpec();
                    break;
                }
            }
        }
        if (packageSpec == null) {
            return OperationResult.failed(new KilnException(String.format("No data spec can package '%s'", path)));
        }

        ProjectPath outputPath = getPackageOutputPath(path, entry);
        status = Status.PACKAGING;
        interruptTargets = new IDataSpec[] { packageSpec };
        try {
            PackageDepsgraph depsgraph;
            try {
                depsgraph = buildPackageDepsgraph(path, entry);
            } catch (KilnException e) {
                logger.severe(e.getMessage());
                return OperationResult.failed(e);
            }

            Set<ProjectPath> missing = new LinkedHashSet<ProjectPath>();
            for (PackageDepsgraph.Node node : depsgraph.getDataNodes()) {
                if (!node.getCookedPath().isFile()) {
                    missing.add(node.getPath());
                }
            }
            if (!missing.isEmpty()) {
                MissingDependencyException e = new MissingDependencyException(new ArrayList<ProjectPath>(missing));
                logger.severe("Unable to package '%s': %s", path, e.getMessage());
                return OperationResult.failed(e);
            }

            OperationResult result = new OperationResult();
            try {
                packageSpec.doPackage(path, entry, depsgraph, outputPath, fast, progress, workers);
            } catch (CookExceptionError | IOException | RuntimeException e) {
                deletePackage(outputPath);
                if (cookInterrupted) {
                    result.setResult(OperationResult.Result.INTERRUPTED);
                    return result;
                }
                logger.log(Level.SEVERE, String.format("Unable to package '%s'", path), e);
                return OperationResult.failed(new KilnException(String.format("Unable to package '%s'", path), e));
            }
            if (cookInterrupted) {
                deletePackage(outputPath);
                result.setResult(OperationResult.Result.INTERRUPTED);
                return result;
            }
            TaskResult taskResult = new TaskResult(path, entry.getName());
            taskResult.setMessage(outputPath.getRelativePath());
            result.addTaskResult(taskResult);
            return result;
        } finally {
            interruptTargets = new IDataSpec[0];
            status = Status.VALID;
        }
    }

    private void deletePackage(ProjectPath outputPath) {
        try {
            FileUtil.deleteIfExists(outputPath.toFile());
        } catch (IOException e) {
            logger.warning("Unable to delete incomplete package '%s': %s", outputPath, e.getMessage());
        }
    }

    /**
     * Build a disc image from the package outputs of a data spec
     * @param entry data spec whose out/ directory is imaged
     * @param writer image writer
     * @param progress progress sink
     * @return outcome
     */
    public OperationResult buildImage(DataSpecEntry entry, IImageWriter writer, IProgress progress) {
        if (!isValid()) {
            return OperationResult.failed(invalidProject());
        }
        File directory = outputRoot.resolve(entry.getName()).toFile();
        try {
            long size = writer.estimateSize(directory);
            logger.info("Building %d byte image of %s", size, directory);
            writer.build(directory, progress);
        } catch (IOException e) {
            logger.log(Level.SEVERE, String.format("Unable to build image of '%s'", directory), e);
            return OperationResult.failed(new KilnException(String.format("Unable to build image of '%s'", directory), e));
        }
        return new OperationResult();
    }

    // Extracting

    /**
     * Ask every registered data spec if it can extract a source
     * @param info extract parameters
     * @return reports of the data specs that can extract, in registration order
     */
    public Map<DataSpecEntry, List<ExtractReport>> canExtract(ExtractPassInfo info) {
        Map<DataSpecEntry, List<ExtractReport>> result = new LinkedHashMap<DataSpecEntry, List<ExtractReport>>();
        for (DataSpecEntry entry : registry.getEntries()) {
            List<ExtractReport> reports = new ArrayList<ExtractReport>();
            if (entry.create(this, DataSpecTool.EXTRACT).canExtract(info, reports)) {
                result.put(entry, reports);
            }
        }
        return result;
    }

    /**
     * Extract a packaged source into the working tree with every data spec
     * that recognises it
     * @param info extract parameters
     * @param progress progress sink
     * @return outcome with one task result per extracting data spec
     */
    public OperationResult extract(ExtractPassInfo info, IProgress progress) {
        if (!isValid()) {
            return OperationResult.failed(invalidProject());
        }
        List<IDataSpec> extractors = new ArrayList<IDataSpec>();
        for (DataSpecEntry entry : registry.getEntries()) {
            IDataSpec dataSpec = entry.create(this, DataSpecTool.EXTRACT);
            if (dataSpec.canExtract(info, new ArrayList<ExtractReport>())) {
                extractors.add(dataSpec);
            }
        }
        if (extractors.isEmpty()) {
            return OperationResult.failed(new KilnException(String.format("No data spec can extract '%s'", info.getSourcePath())));
        }
        OperationResult result = new OperationResult();
        for (IDataSpec dataSpec : extractors) {
            TaskResult taskResult = new TaskResult(workRoot, dataSpec.getDataSpecEntry().getName());
            try {
                dataSpec.doExtract(info, progress);
            } catch (CookExceptionError | IOException e) {
                logger.warning("%s failed to extract '%s': %s", dataSpec.getDataSpecEntry().getName(), info.getSourcePath(), e.getMessage());
                taskResult.setResult(TaskResult.Result.FAILED);
                taskResult.setMessage(e.getMessage());
                taskResult.setException(e);
                result.setResult(OperationResult.Result.FAILED);
            }
            result.addTaskResult(taskResult);
        }
        return result;
    }

    // Bridge cache

    public void addBridgePathToCache(long id, ProjectPath path) {
        bridgePathCache.add(id, path);
    }

    public void clearBridgePathCache() {
        bridgePathCache.clear();
    }

    /**
     * Lookup the working path of an object id
     * @param id object id
     * @return path or null if the id isn't in the cache
     */
    public ProjectPath lookupBridgePath(long id) {
        return bridgePathCache.lookup(id);
    }
}
