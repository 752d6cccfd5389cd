package org.mides.delivery.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

final class PathReconstruction {

    private PathReconstruction() {
    }

    /* Empty if the links never reach start */
    static List<String> walkBack(Map<String, String> previous, String start, String end) {
        var path = new ArrayList<String>();
        String current = end;
        while (current != null) {
            path.add(current);
            current = previous.get(current);
        }
        Collections.reverse(path);

        if (!path.get(0).equals(start))
            return List.of();
        return path;
    }
}
