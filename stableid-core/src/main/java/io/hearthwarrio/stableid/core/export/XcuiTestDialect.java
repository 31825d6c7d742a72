package io.hearthwarrio.stableid.core.export;

/**
 * XCTest / XCUITest in Swift, elements looked up by accessibility identifier.
 */
public final class XcuiTestDialect implements ScriptDialect {

    @Override
    public String fileExtension() {
        return ".swift";
    }

    @Override
    public String header(String screenContext) {
        return "// Generated UI test code\n" +
                "// Screen: " + screenContext + "\n" +
                "import XCTest\n" +
                "\n" +
                "final class GeneratedUITests: XCTestCase {\n" +
                "\n" +
                "    func test_generated_ui_elements() {\n" +
                "        let app = XCUIApplication()\n" +
                "        app.launch()\n" +
                "\n";
    }

    @Override
    public String locate(String variable, String identifier) {
        return "        let " + variable + " = app.descendants(matching: .any)[" + ScriptDialect.quote(identifier) + "]\n" +
                "        XCTAssertTrue(" + variable + ".exists, " +
                ScriptDialect.quote("Element '" + identifier + "' should exist") + ")\n";
    }

    @Override
    public String action(String variable, ElementAction action) {
        switch (action) {
            case TAP:
                return "        " + variable + ".tap()\n";
            case TYPE:
                return "        " + variable + ".tap()\n" +
                        "        " + variable + ".typeText(\"text\")\n";
            case NONE:
            default:
                return "";
        }
    }

    @Override
    public String footer() {
        return "    }\n" +
                "}\n";
    }

    @Override
    public String tapAction(String identifier) {
        return "app.otherElements[" + ScriptDialect.quote(identifier) + "].element.tap()";
    }

    @Override
    public String textInputAction(String identifier, String text) {
        return "app.textFields[" + ScriptDialect.quote(identifier) + "].element.typeText(" + ScriptDialect.quote(text) + ")";
    }
}
