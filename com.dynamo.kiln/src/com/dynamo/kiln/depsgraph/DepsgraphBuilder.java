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

package com.dynamo.kiln.depsgraph;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.dynamo.kiln.depsgraph.PackageDepsgraph.Node;
import com.dynamo.kiln.depsgraph.PackageDepsgraph.NodeType;
import com.dynamo.kiln.fs.ProjectPath;
import com.dynamo.kiln.object.ObjectBase;

/**
 * Builds a {@link PackageDepsgraph} from root objects.
 *
 * Every object lands in a container: a group or the top level. A root
 * object goes to its own group, or the top level if it has none. A
 * dependency of an object inside a group is pulled into that same group so
 * that a group can be loaded on its own; other dependencies go to their own
 * group or the top level.
 *
 * An object is materialized once, where it is first discovered. The only
 * copies made are for groups: an object already placed in one group is
 * placed again when a second group pulls it in. A group lists its objects
 * in the order they were discovered.
 */
public class DepsgraphBuilder {

    private final ProjectPath workRoot;
    private final ProjectPath cookedRoot;
    private final List<ProjectPath> groups;

    private final List<Node> nodes = new ArrayList<Node>();
    private final List<Integer> topLevel = new ArrayList<Integer>();
    private final Map<ProjectPath, Integer> groupNodes = new HashMap<ProjectPath, Integer>();
    private final Map<Integer, List<Integer>> groupChildren = new HashMap<Integer, List<Integer>>();
    private final Set<ProjectPath> materialized = new HashSet<ProjectPath>();
    private final Map<ProjectPath, Set<ProjectPath>> groupCopies = new HashMap<ProjectPath, Set<ProjectPath>>();
    private final Map<ProjectPath, List<ObjectBase>> gatheredDeps = new HashMap<ProjectPath, List<ObjectBase>>();

    /**
     * @param rootPath path the package is rooted at
     * @param workRoot project working root
     * @param cookedRoot cooked root of the data spec, may be null
     * @param groups registered group directories
     */
    public DepsgraphBuilder(ProjectPath rootPath, ProjectPath workRoot, ProjectPath cookedRoot, List<ProjectPath> groups) {
        this.workRoot = workRoot;
        this.cookedRoot = cookedRoot;
        this.groups = new ArrayList<ProjectPath>(groups);
        nodes.add(new Node(0, NodeType.GROUP, rootPath, cookedPath(rootPath), null));
    }

    private ProjectPath cookedPath(ProjectPath path) {
        return cookedRoot != null ? path.rebase(workRoot, cookedRoot) : null;
    }

    /**
     * Get the group a path belongs to
     * @param path working path
     * @return group directory or null if the path isn't in a group
     */
    public ProjectPath groupOf(ProjectPath path) {
        for (ProjectPath group : groups) {
            if (path.isUnder(group)) {
                return group;
            }
        }
        return null;
    }

    /**
     * Add a root object and everything it depends on
     * @param object root object
     * @throws IOException if dependencies can't be gathered
     */
    public void add(ObjectBase object) throws IOException {
        visit(object, groupOf(object.getPath()));
    }

    private void visit(ObjectBase object, ProjectPath container) throws IOException {
        ProjectPath path = object.getPath();
        if (!materialized.add(path)) {
            Set<ProjectPath> copies = groupCopies.get(path);
            if (container == null || copies == null || !copies.add(container)) {
                return;
            }
        } else if (container != null) {
            groupCopies.computeIfAbsent(path, k -> new HashSet<ProjectPath>()).add(container);
        }

        List<Integer> siblings = container == null ? topLevel : groupChildren.get(groupNode(container));
        int index = nodes.size();
        nodes.add(new Node(index, NodeType.DATA, path, cookedPath(path), object));
        siblings.add(index);

        for (ObjectBase dep : gatherDeps(object)) {
            ProjectPath depContainer = container != null ? container : groupOf(dep.getPath());
            visit(dep, depContainer);
        }
    }

    private List<ObjectBase> gatherDeps(ObjectBase object) throws IOException {
        List<ObjectBase> deps = gatheredDeps.get(object.getPath());
        if (deps == null) {
            List<ObjectBase> collected = new ArrayList<ObjectBase>();
            object.gatherDeps(collected::add);
            deps = collected;
            gatheredDeps.put(object.getPath(), deps);
        }
        return deps;
    }

    private int groupNode(ProjectPath group) {
        Integer index = groupNodes.get(group);
        if (index == null) {
            index = nodes.size();
            nodes.add(new Node(index, NodeType.GROUP, group, cookedPath(group), null));
            groupNodes.put(group, index);
            groupChildren.put(index, new ArrayList<Integer>());
            topLevel.add(index);
        }
        return index;
    }

    private void link(Node parent, List<Integer> children) {
        int previous = PackageDepsgraph.NONE;
        for (int child : children) {
            if (previous == PackageDepsgraph.NONE) {
                parent.sub = child;
            } else {
                nodes.get(previous).next = child;
            }
            previous = child;
        }
    }

    public PackageDepsgraph build() {
        link(nodes.get(0), topLevel);
        for (Map.Entry<Integer, List<Integer>> e : groupChildren.entrySet()) {
            link(nodes.get(e.getKey()), e.getValue());
        }
        return new PackageDepsgraph(new ArrayList<Node>(nodes));
    }
}
