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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.codehaus.jackson.JsonFactory;
import org.codehaus.jackson.JsonGenerator;

import com.dynamo.kiln.fs.ProjectPath;
import com.dynamo.kiln.object.ObjectBase;

/**
 * Dependency tree used to lay out a package. Nodes live in an arena and link
 * to their first child (sub) and next sibling (next) by index. Node 0 is the
 * root; its children are top-level objects and group nodes. Traversal
 * order (depth first, node before children) is the package layout order, so
 * the members of a group are contiguous.
 */
public class PackageDepsgraph {

    public static final int NONE = -1;

    public enum NodeType {
        DATA,
        GROUP
    }

    public static final class Node {
        private final int index;
        private final NodeType type;
        private final ProjectPath path;
        private final ProjectPath cookedPath;
        private final ObjectBase object;
        int sub = NONE;
        int next = NONE;

        Node(int index, NodeType type, ProjectPath path, ProjectPath cookedPath, ObjectBase object) {
            this.index = index;
            this.type = type;
            this.path = path;
            this.cookedPath = cookedPath;
            this.object = object;
        }

        public int getIndex() {
            return index;
        }

        public NodeType getType() {
            return type;
        }

        public ProjectPath getPath() {
            return path;
        }

        /**
         * @return cooked path, null if the graph was built without a cooked tree
         */
        public ProjectPath getCookedPath() {
            return cookedPath;
        }

        /**
         * @return object of a data node, null for group nodes
         */
        public ObjectBase getObject() {
            return object;
        }

        public int getSub() {
            return sub;
        }

        public int getNext() {
            return next;
        }

        @Override
        public String toString() {
            return String.format("%d %s %s", index, type, path);
        }
    }

    private final List<Node> nodes;

    PackageDepsgraph(List<Node> nodes) {
        this.nodes = nodes;
    }

    public Node getRootNode() {
        return nodes.get(0);
    }

    public Node getNode(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Get the direct children of a node in sibling order
     * @param node parent node
     * @return children
     */
    public List<Node> getChildren(Node node) {
        List<Node> children = new ArrayList<Node>();
        for (int i = node.sub; i != NONE; i = nodes.get(i).next) {
            children.add(nodes.get(i));
        }
        return children;
    }

    /**
     * Get all nodes below the root in traversal order
     * @return nodes, parents before their children
     */
    public List<Node> traverse() {
        List<Node> result = new ArrayList<Node>(nodes.size());
        traverse(getRootNode().sub, result);
        return result;
    }

    private void traverse(int index, List<Node> result) {
        for (int i = index; i != NONE; i = nodes.get(i).next) {
            Node node = nodes.get(i);
            result.add(node);
            traverse(node.sub, result);
        }
    }

    /**
     * Get the data nodes in traversal order. An object pulled into several
     * groups occurs once per group.
     * @return data nodes
     */
    public List<Node> getDataNodes() {
        List<Node> result = new ArrayList<Node>();
        for (Node node : traverse()) {
            if (node.type == NodeType.DATA) {
                result.add(node);
            }
        }
        return result;
    }

    private void writeJSON(Node node, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeNumberField("index", node.index);
        generator.writeStringField("type", node.type.name());
        generator.writeStringField("path", node.path.getRelativePath());
        if (node.cookedPath != null) {
            generator.writeStringField("cookedPath", node.cookedPath.getRelativePath());
        }
        if (node.object != null) {
            generator.writeStringField("objectType", node.object.getType().toString());
            generator.writeStringField("id", String.format("%016x", node.object.getId()));
        }
        generator.writeNumberField("sub", node.sub);
        generator.writeNumberField("next", node.next);
        generator.writeEndObject();
    }

    private void writeJSON(Writer writer) throws IOException {
        JsonGenerator generator = null;
        try {
            generator = (new JsonFactory()).createJsonGenerator(writer);
            generator.useDefaultPrettyPrinter();
            generator.writeStartArray();
            for (Node node : nodes) {
                writeJSON(node, generator);
            }
            generator.writeEndArray();
        }
        finally {
            if (generator != null) {
                generator.close();
            }
            IOUtils.closeQuietly(writer);
        }
    }

    public void writeJSON(OutputStream os) throws IOException {
        writeJSON(new BufferedWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8)));
    }

    public String toJSON() throws IOException {
        StringWriter stringWriter = new StringWriter();
        writeJSON(new BufferedWriter(stringWriter));
        return stringWriter.toString();
    }
}
