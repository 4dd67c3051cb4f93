package io.hearthwarrio.elementscout.webdriver;

import io.hearthwarrio.elementscout.core.dom.BoundingRect;
import io.hearthwarrio.elementscout.core.dom.ComputedStyle;
import io.hearthwarrio.elementscout.core.dom.DomElement;
import io.hearthwarrio.elementscout.core.dom.ElementKind;
import io.hearthwarrio.elementscout.core.dom.FormControl;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DomElement} backed by a Selenium {@link WebElement}.
 * <p>
 * Equality follows {@link WebElement#equals(Object)}, which compares the driver's element reference,
 * so two handles for the same node are equal.
 * <p>
 * Every property is read from the browser once per handle and kept afterwards. Bounding box, offset parent
 * and computed style come from one script call, as do all form control properties. A handle therefore
 * describes the node as it was when first asked, and a scan should use fresh handles.
 */
public final class WebDriverDomElement implements DomElement {

    private static final String TEXT_CONTENT_JS = "return arguments[0].textContent;";
    private static final String PARENT_JS = "return arguments[0].parentElement;";
    private static final String CHILDREN_JS = "return Array.prototype.slice.call(arguments[0].children);";
    private static final String LAYOUT_JS =
            "var e=arguments[0], r=e.getBoundingClientRect(), s=window.getComputedStyle(e);" +
                    "return {x:r.x, y:r.y, width:r.width, height:r.height, offsetParent:(e.offsetParent !== null)," +
                    " display:s.display, visibility:s.visibility};";
    private static final String FORM_CONTROL_JS =
            "var e=arguments[0];" +
                    "return {value:(e.value == null ? '' : String(e.value)), type:(e.type || '')," +
                    " disabled:!!e.disabled, readOnly:!!e.readOnly, checked:!!e.checked, selected:!!e.selected};";

    private final WebElement element;
    private final JavascriptExecutor js;

    private String tagName;
    private String textContent;
    private DomElement parent;
    private boolean parentRead;
    private List<DomElement> children;
    private BoundingRect rect;
    private boolean offsetParent;
    private ComputedStyle style;
    private FormControl formControl;
    private boolean formControlRead;

    WebDriverDomElement(WebElement element, JavascriptExecutor js) {
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.js = Objects.requireNonNull(js, "js must not be null");
    }

    /**
     * @return underlying Selenium element
     */
    public WebElement getWebElement() {
        return element;
    }

    @Override
    public String tagName() {
        if (tagName == null) {
            String raw = element.getTagName();
            tagName = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
        }
        return tagName;
    }

    @Override
    public String attribute(String name) {
        return element.getDomAttribute(name);
    }

    @Override
    public String textContent() {
        if (textContent == null) {
            Object v = js.executeScript(TEXT_CONTENT_JS, element);
            textContent = v == null ? "" : String.valueOf(v);
        }
        return textContent;
    }

    @Override
    public DomElement parent() {
        if (!parentRead) {
            Object v = js.executeScript(PARENT_JS, element);
            parent = v instanceof WebElement ? new WebDriverDomElement((WebElement) v, js) : null;
            parentRead = true;
        }
        return parent;
    }

    @Override
    public List<DomElement> children() {
        if (children == null) {
            children = readChildren();
        }
        return children;
    }

    private List<DomElement> readChildren() {
        Object v = js.executeScript(CHILDREN_JS, element);
        if (!(v instanceof List)) {
            return Collections.emptyList();
        }
        List<?> raw = (List<?>) v;
        List<DomElement> out = new ArrayList<>(raw.size());
        for (Object child : raw) {
            if (child instanceof WebElement) {
                out.add(new WebDriverDomElement((WebElement) child, js));
            }
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public BoundingRect boundingRect() {
        readLayout();
        return rect;
    }

    @Override
    public boolean hasOffsetParent() {
        readLayout();
        return offsetParent;
    }

    @Override
    public ComputedStyle computedStyle() {
        readLayout();
        return style;
    }

    private void readLayout() {
        if (rect != null) {
            return;
        }
        Map<?, ?> m = asMap(js.executeScript(LAYOUT_JS, element));
        offsetParent = bool(m, "offsetParent");
        style = new ComputedStyle(str(m, "display"), str(m, "visibility"));
        rect = new BoundingRect(num(m, "x"), num(m, "y"), num(m, "width"), num(m, "height"));
    }

    @Override
    public FormControl formControl() {
        if (!formControlRead) {
            formControl = kind() == ElementKind.FORM_CONTROL ? readFormControl() : null;
            formControlRead = true;
        }
        return formControl;
    }

    private FormControl readFormControl() {
        Map<?, ?> p = asMap(js.executeScript(FORM_CONTROL_JS, element));
        return new SnapshotFormControl(
                str(p, "value"),
                str(p, "type").toLowerCase(Locale.ROOT),
                bool(p, "disabled"),
                bool(p, "readOnly"),
                bool(p, "checked"),
                bool(p, "selected")
        );
    }

    private static Map<?, ?> asMap(Object v) {
        return v instanceof Map ? (Map<?, ?>) v : Collections.emptyMap();
    }

    private static double num(Map<?, ?> m, String key) {
        Object v = m.get(key);
        return v instanceof Number ? ((Number) v).doubleValue() : 0.0;
    }

    private static String str(Map<?, ?> m, String key) {
        Object v = m.get(key);
        return v == null ? "" : String.valueOf(v);
    }

    private static boolean bool(Map<?, ?> m, String key) {
        return Boolean.TRUE.equals(m.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WebDriverDomElement)) return false;
        WebDriverDomElement that = (WebDriverDomElement) o;
        return element.equals(that.element);
    }

    @Override
    public int hashCode() {
        return element.hashCode();
    }

    @Override
    public String toString() {
        return "WebDriverDomElement{" + element + '}';
    }

    /**
     * Form control properties read in one script call.
     */
    private static final class SnapshotFormControl implements FormControl {
        private final String value;
        private final String type;
        private final boolean disabled;
        private final boolean readOnly;
        private final boolean checked;
        private final boolean selected;

        private SnapshotFormControl(
                String value,
                String type,
                boolean disabled,
                boolean readOnly,
                boolean checked,
                boolean selected
        ) {
            this.value = value;
            this.type = type;
            this.disabled = disabled;
            this.readOnly = readOnly;
            this.checked = checked;
            this.selected = selected;
        }

        @Override
        public String value() {
            return value;
        }

        @Override
        public String type() {
            return type;
        }

        @Override
        public boolean isDisabled() {
            return disabled;
        }

        @Override
        public boolean isReadOnly() {
            return readOnly;
        }

        @Override
        public boolean isChecked() {
            return checked;
        }

        @Override
        public boolean isSelected() {
            return selected;
        }
    }
}
