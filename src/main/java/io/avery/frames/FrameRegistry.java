/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.frames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Frames by name, for pipeline steps that reference other frames ({@code concat}, {@code join}). A registry is an
 * ordinary object owned by the caller; there is no shared global registry.
 */
public class FrameRegistry {
    private final Map<String, DataFrame> frames = new LinkedHashMap<>();
    
    /**
     * Registers a frame under its own name, replacing any frame of that name.
     *
     * @param frame the frame
     * @return this registry
     */
    public FrameRegistry register(DataFrame frame) {
        return register(frame.name(), frame);
    }
    
    public FrameRegistry register(String name, DataFrame frame) {
        frames.put(Objects.requireNonNull(name), Objects.requireNonNull(frame));
        return this;
    }
    
    /**
     * Returns the frame registered under the given name.
     *
     * @param name the name
     * @return the frame
     * @throws NoSuchElementException if no frame is registered under the name
     */
    public DataFrame get(String name) {
        DataFrame frame = frames.get(name);
        if (frame == null)
            throw new NoSuchElementException("Invalid frame: " + name);
        return frame;
    }
    
    public boolean contains(String name) {
        return frames.containsKey(name);
    }
    
    public DataFrame remove(String name) {
        return frames.remove(name);
    }
    
    public Set<String> names() {
        return Collections.unmodifiableSet(frames.keySet());
    }
}
