package com.osman.exrtool.core.merge;

import com.osman.exrtool.core.codec.ExrChannel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Channel table of one frame, kept sorted by name with each name present once.
 * Putting a name that is already present replaces its plane and pixel type.
 */
public final class MergedChannelSet {

    private final List<ChannelPlane> planes = new ArrayList<>();

    /**
     * Inserts the plane in name order, or replaces the existing plane of the same name.
     *
     * @return the replaced plane, or {@code null} when the name was new.
     */
    public ChannelPlane put(ChannelPlane plane) {
        int index = indexOf(plane.name());
        if (index >= 0) {
            return planes.set(index, plane);
        }
        planes.add(-index - 1, plane);
        return null;
    }

    public ChannelPlane get(String name) {
        int index = indexOf(name);
        return index >= 0 ? planes.get(index) : null;
    }

    public boolean isEmpty() {
        return planes.isEmpty();
    }

    public int size() {
        return planes.size();
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(planes.size());
        planes.forEach(plane -> names.add(plane.name()));
        return names;
    }

    public List<ExrChannel> channels() {
        List<ExrChannel> channels = new ArrayList<>(planes.size());
        planes.forEach(plane -> channels.add(plane.channel()));
        return channels;
    }

    public List<byte[]> samples() {
        List<byte[]> samples = new ArrayList<>(planes.size());
        planes.forEach(plane -> samples.add(plane.samples()));
        return samples;
    }

    public List<ChannelPlane> planes() {
        return Collections.unmodifiableList(planes);
    }

    private int indexOf(String name) {
        int low = 0;
        int high = planes.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = planes.get(mid).name().compareTo(name);
            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }
}
