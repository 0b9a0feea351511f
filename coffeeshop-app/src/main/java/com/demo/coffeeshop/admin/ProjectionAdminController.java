package com.demo.coffeeshop.admin;

import com.myorg.cafe.eventstore.replay.ProjectionReplayer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/admin/projections")
@RequiredArgsConstructor
public class ProjectionAdminController {

    private final ProjectionReplayer replayer;

    @PostMapping("/{group}/replay")
    public ProjectionReplayer.ReplayResult replay(@PathVariable String group) {
        return replayer.replay(group);
    }
}
