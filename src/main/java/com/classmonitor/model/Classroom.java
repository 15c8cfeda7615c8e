package com.classmonitor.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Classroom entity. Each classroom owns one camera reachable at {@code deviceAddress}.
 */
@Table("classrooms")
public class Classroom {

    @Id
    private Long id;

    @Column("name")
    private String name;

    @Column("device_address")
    private String deviceAddress;

    @Column("qr_payload")
    private String qrPayload;

    public Classroom() {
    }

    public Classroom(String name, String deviceAddress) {
        this.name = name;
        this.deviceAddress = deviceAddress;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDeviceAddress() {
        return deviceAddress;
    }

    public void setDeviceAddress(String deviceAddress) {
        this.deviceAddress = deviceAddress;
    }

    public String getQrPayload() {
        return qrPayload;
    }

    public void setQrPayload(String qrPayload) {
        this.qrPayload = qrPayload;
    }
}
