package io.hearthwarrio.xlocator.core;

/**
 * Archetype labels used by the default classification rules.
 */
public enum WidgetArchetype {
    PUSH_BUTTON("PushButtonQT"),
    CHECK_BOX("CheckBoxQT"),
    RADIO_BUTTON("RadioButtonQT"),
    COMBO_BOX("ComboBoxQT"),
    SLIDER("SliderQT"),
    LABEL("LabelQT"),
    SCROLL_VIEW("ScrollViewQT"),
    TEXT_FIELD("TextFieldQT"),
    MODULE("ModuleQT"),
    /**
     * Fallback when no rule matches.
     */
    WIDGET("QWidget");

    private final String label;

    WidgetArchetype(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
