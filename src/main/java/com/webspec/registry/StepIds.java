package com.webspec.registry;

/**
 * Identifiers of the built-in steps. Shared by {@link DefaultStepPatterns},
 * the handler annotations and {@code step-catalog.json}.
 */
public final class StepIds {

    private StepIds() {}

    public static final String NAVIGATE_TO = "navigate_to";
    public static final String GO_BACK = "go_back";
    public static final String GO_FORWARD = "go_forward";
    public static final String REFRESH_PAGE = "refresh_page";
    public static final String WAIT_FOR_PAGE_LOAD = "wait_for_page_load";
    public static final String WAIT_SECONDS = "wait_seconds";
    public static final String WAIT_MILLISECONDS = "wait_milliseconds";
    public static final String WAIT_FOR_ELEMENT = "wait_for_element";
    public static final String WAIT_FOR_ELEMENT_HIDDEN = "wait_for_element_hidden";
    public static final String WAIT_FOR_TEXT = "wait_for_text";
    public static final String CLICK = "click";
    public static final String DOUBLE_CLICK = "double_click";
    public static final String RIGHT_CLICK = "right_click";
    public static final String HOVER = "hover";
    public static final String TYPE_TEXT = "type_text";
    public static final String CLEAR_FIELD = "clear_field";
    public static final String SELECT_OPTION = "select_option";
    public static final String CHECK_CHECKBOX = "check_checkbox";
    public static final String UNCHECK_CHECKBOX = "uncheck_checkbox";
    public static final String PRESS_KEY = "press_key";
    public static final String SCROLL_TO_BOTTOM = "scroll_to_bottom";
    public static final String SCROLL_TO_TOP = "scroll_to_top";
    public static final String SCROLL_TO_ELEMENT = "scroll_to_element";
    public static final String SHOULD_SEE_TEXT = "should_see_text";
    public static final String SHOULD_NOT_SEE_TEXT = "should_not_see_text";
    public static final String ELEMENT_VISIBLE = "element_visible";
    public static final String ELEMENT_NOT_VISIBLE = "element_not_visible";
    public static final String ELEMENT_TEXT_EQUALS = "element_text_equals";
    public static final String ELEMENT_CONTAINS_TEXT = "element_contains_text";
    public static final String TITLE_EQUALS = "title_equals";
    public static final String TITLE_CONTAINS = "title_contains";
    public static final String URL_CONTAINS = "url_contains";
    public static final String STORE_TEXT = "store_text";
    public static final String EXTRACT_ALL_TEXT = "extract_all_text";
    public static final String STORED_VALUE_EQUALS = "stored_value_equals";
    public static final String EXTRACTED_COUNT_EQUALS = "extracted_count_equals";
    public static final String TAKE_SCREENSHOT = "take_screenshot";
}
