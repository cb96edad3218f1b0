package edu.UOI.wyreframe.web;

import edu.UOI.wyreframe.service.WireframeService;
import edu.UOI.wyreframe.service.WireframeService.CheckRequest;
import edu.UOI.wyreframe.service.WireframeService.CheckResult;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Controller
public class HomeController {

    private final WireframeService wireframeService;

    public HomeController(WireframeService wireframeService) {
        this.wireframeService = wireframeService;
    }

    @GetMapping("/")
    public String home() { return "index"; }

    /** Results page for a pasted wireframe */
    @PostMapping("/check")
    public String check(@RequestParam(name = "text", required = false) String text,
                        @RequestParam(name = "autoFix", defaultValue = "false") boolean autoFix,
                        Model model) {

        if (text == null || text.isBlank()) {
            model.addAttribute("error", "Please paste a wireframe.");
            return "index";
        }

        CheckResult result = wireframeService.check(new CheckRequest(text, autoFix));
        model.addAttribute("result", result);
        model.addAttribute("autoFix", autoFix);
        return "results";
    }
}
