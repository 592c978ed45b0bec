package com.flagship.split_ledger.group;

import com.flagship.split_ledger.group.dto.AddMemberRequest;
import com.flagship.split_ledger.group.dto.CreateGroupRequest;
import com.flagship.split_ledger.group.dto.GroupResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;

    @PostMapping
    public ResponseEntity<GroupResponse> createGroup(@Valid @RequestBody CreateGroupRequest request) {
        List<Member> members = request.getMembers() == null
            ? List.of()
            : request.getMembers().stream().map(Member::of).toList();
        long groupId = groupService.createGroup(request.getName(), Member.of(request.getCreator()), members);
        return ResponseEntity.status(HttpStatus.CREATED).body(GroupResponse.from(groupService.getGroup(groupId)));
    }

    @GetMapping("/{groupId}")
    public GroupResponse getGroup(@PathVariable("groupId") long groupId) {
        return GroupResponse.from(groupService.getGroup(groupId));
    }

    /**
     * Groups the member belongs to, newest first.
     */
    @GetMapping
    public List<GroupResponse> listGroups(@RequestParam("member") String member) {
        return groupService.listGroupIdsFor(Member.of(member)).stream()
            .map(groupService::getGroup)
            .map(GroupResponse::from)
            .toList();
    }

    @PostMapping("/{groupId}/members")
    public GroupResponse addMember(@PathVariable("groupId") long groupId,
                                   @Valid @RequestBody AddMemberRequest request) {
        groupService.addMember(groupId, Member.of(request.member()));
        return GroupResponse.from(groupService.getGroup(groupId));
    }
}
