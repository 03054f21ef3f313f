package com.repledger.api.controller;

import com.repledger.api.dto.response.BalanceResponse;
import com.repledger.custody.AssetCustody;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/assets")
public class AssetController {

    private final AssetCustody assetCustody;

    public AssetController(AssetCustody assetCustody) {
        this.assetCustody = assetCustody;
    }

    @GetMapping("/{asset}/balances/{owner}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String asset, @PathVariable String owner) {
        return ResponseEntity.ok(BalanceResponse.builder()
                .asset(asset)
                .owner(owner)
                .balance(assetCustody.balanceOf(asset, owner))
                .build());
    }
}
