package github.sarthakdev143.render_farm.integration.blender;

/**
 * Python snippets passed to Blender with {@code --python-expr}. File Output nodes are always
 * enumerated the same way (scenes in order, then compositor nodes in order) so a node index
 * means the same node in every script.
 */
final class BlenderPythonScripts {

    static final String SCENE_LINE_PREFIX = "RENDER_FARM_SCENE ";

    private static final String COLLECT_OUTPUT_NODES = String.join("\n",
            "def _output_nodes():",
            "    found = []",
            "    for sc in bpy.data.scenes:",
            "        if sc.use_nodes and sc.node_tree:",
            "            found.extend(n for n in sc.node_tree.nodes if n.type == 'OUTPUT_FILE')",
            "    return found",
            "def _is_multilayer(node):",
            "    return node.format.file_format == 'OPEN_EXR_MULTILAYER'");

    static final String INSPECT_SCENE = String.join("\n",
            "import bpy, json",
            COLLECT_OUTPUT_NODES,
            "nodes = []",
            "for node in _output_nodes():",
            "    if _is_multilayer(node):",
            "        slots = [{'name': s.name, 'path': s.name} for s in node.layer_slots]",
            "    else:",
            "        slots = [{'name': s.path, 'path': s.path} for s in node.file_slots]",
            "    nodes.append({'name': node.name, 'base_path': node.base_path,",
            "                  'format': {'file_format': node.format.file_format,",
            "                             'color_depth': node.format.color_depth,",
            "                             'color_mode': node.format.color_mode},",
            "                  'slots': slots})",
            "scene = bpy.context.scene",
            "print('" + SCENE_LINE_PREFIX + "' + json.dumps({'frame_start': scene.frame_start,",
            "    'frame_end': scene.frame_end, 'frame_current': scene.frame_current, 'nodes': nodes}))");

    static final String UNPACK_AND_SAVE = String.join("\n",
            "import bpy",
            "bpy.ops.file.unpack_all(method='USE_LOCAL')",
            "bpy.ops.wm.save_as_mainfile(filepath=bpy.data.filepath)");

    private static final String APPLY_GRAPH_TEMPLATE = String.join("\n",
            "import bpy, json",
            COLLECT_OUTPUT_NODES,
            "graph = json.loads(%s)",
            "for node, spec in zip(_output_nodes(), graph):",
            "    node.base_path = spec['base_path']",
            "    if _is_multilayer(node):",
            "        for slot, path in zip(node.layer_slots, spec['slots']):",
            "            slot.name = path",
            "    else:",
            "        for slot, path in zip(node.file_slots, spec['slots']):",
            "            slot.path = path");

    private BlenderPythonScripts() {
    }

    /**
     * @param graphJsonLiteral the graph JSON, itself encoded as a JSON string literal
     */
    static String applyGraph(String graphJsonLiteral) {
        return String.format(APPLY_GRAPH_TEMPLATE, graphJsonLiteral);
    }
}
