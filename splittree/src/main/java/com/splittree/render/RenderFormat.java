package com.splittree.render;

public enum RenderFormat {
    ASCII {
        @Override
        public TreeRenderer renderer() {
            return new AsciiTreeRenderer();
        }
    },
    JSON {
        @Override
        public TreeRenderer renderer() {
            return new JsonTreeRenderer(true);
        }
    };

    public abstract TreeRenderer renderer();
}
