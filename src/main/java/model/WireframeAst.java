package model;

import java.util.List;
import java.util.Optional;

/** Parsed document: scenes in source order. */
public record WireframeAst(List<Scene> scenes) {

    public WireframeAst {
        scenes = List.copyOf(scenes);
    }

    public Optional<Scene> findScene(String id) {
        return scenes.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public List<String> sceneIds() {
        return scenes.stream().map(Scene::id).toList();
    }
}
