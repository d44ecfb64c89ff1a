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

package com.dynamo.kiln.image;

import java.io.File;
import java.io.IOException;

import com.dynamo.kiln.IProgress;

/**
 * Builds a platform disc image from a directory of packaged files
 */
public interface IImageWriter {

    /**
     * Estimate the size of the image without writing it
     * @param directory directory with the image content
     * @return estimated image size in bytes
     * @throws IOException if the directory can't be read or the content doesn't fit
     */
    long estimateSize(File directory) throws IOException;

    /**
     * Write the image
     * @param directory directory with the image content
     * @param progress progress sink
     * @throws IOException
     */
    void build(File directory, IProgress progress) throws IOException;
}
